package com.example.examSchedulerBackend.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Fields recovered from the text a vision model produced for an uploaded
 * exam-schedule image.
 */
@Data
@NoArgsConstructor
public class ExtractedExamData {
    private String examName = "";
    private String department = "";
    private String semester = "S1";
    private String batch = "A";
    private String academicYear = "";
    private List<String> dates = new ArrayList<>();
    private List<String> labs = new ArrayList<>();
    private List<Examiner> internalExaminers = new ArrayList<>();
    private List<Examiner> externalExaminers = new ArrayList<>();
    private List<String> subjects = new ArrayList<>();
    private List<String> registerNumbers = new ArrayList<>();
    private String rawText = "";
}
