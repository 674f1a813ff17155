package com.example.examSchedulerBackend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExamMetadata {
    private String examName;
    private String semester;
    private String department;
    private String academicYear;
}
