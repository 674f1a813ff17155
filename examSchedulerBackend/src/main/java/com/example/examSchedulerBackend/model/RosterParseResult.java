package com.example.examSchedulerBackend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RosterParseResult {

    private boolean success;

    @Builder.Default
    private List<Semester> semesters = new ArrayList<>();

    private int totalStudents;
    private String message;
    private String error;
}
