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
public class DateSelectionResponse {

    private boolean success;
    private List<String> selectedDates;
    private List<ExamDate> examDates;
    private int requiredDays;
    private int availableDays;
    private int studentsPerDay;
    private String message;
    private ScheduleInfo scheduleInfo;

    @Builder.Default
    private List<ValidationError> errors = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScheduleInfo {
        private int totalStudents;
        private int daysNeeded;
        private int daysSelected;
        private int minGapRequested;
    }
}
