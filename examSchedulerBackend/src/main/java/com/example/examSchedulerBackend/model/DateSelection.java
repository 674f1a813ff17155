package com.example.examSchedulerBackend.model;

import lombok.Value;

import java.util.List;

@Value
public class DateSelection {
    List<String> selectedDates;
    String message;
    int requiredDays;
}
