package com.example.examSchedulerBackend.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DateSelectionRequest {

    @NotNull(message = "Available dates cannot be null")
    private List<String> availableDates = new ArrayList<>();

    @Min(value = 0, message = "Student count cannot be negative")
    private int studentCount;

    private int minGapDays = 1;

    private List<String> subjects;
}
