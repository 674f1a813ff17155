package com.example.examSchedulerBackend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiResponse {
    private boolean success;
    private ScheduleResponse data;
    private List<ValidationError> errors = new ArrayList<>();
    private List<String> warnings = new ArrayList<>();

    public static ApiResponse ok(ScheduleResponse data, List<String> warnings) {
        return new ApiResponse(true, data, new ArrayList<>(), warnings);
    }

    public static ApiResponse failed(List<ValidationError> errors, List<String> warnings) {
        return new ApiResponse(false, null, errors, warnings);
    }
}
