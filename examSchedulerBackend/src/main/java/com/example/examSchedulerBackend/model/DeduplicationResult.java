package com.example.examSchedulerBackend.model;

import lombok.Value;

import java.util.List;

@Value
public class DeduplicationResult {
    // first occurrences, input order
    List<String> unique;
    // repeats, in the order they were met
    List<String> duplicates;

    public boolean hasDuplicates() {
        return !duplicates.isEmpty();
    }
}
