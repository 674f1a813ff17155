package com.example.examSchedulerBackend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidationReport {

    private boolean success;
    private List<ValidationError> errors = new ArrayList<>();
    private List<String> warnings = new ArrayList<>();
    private Summary summary;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private int totalStudents;
        private int duplicatesFound;
        private int datesProvided;
        private int labsProvided;
        private int internalExaminers;
        private int externalExaminers;
        private int semesters;
    }
}
