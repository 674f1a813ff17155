package com.example.examSchedulerBackend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleResponse {
    private ExamMetadata examMetadata;
    private Map<String, List<Examiner>> examiners = new LinkedHashMap<>();
    private List<LabSchedule> schedule = new ArrayList<>();
}
