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
public class ImageAnalysisResponse {

    private boolean success;

    @Builder.Default
    private List<Semester> semesters = new ArrayList<>();

    private int totalStudents;
    private ExtractedExamData extractedData;
    private String rawResponse;
    private String message;
    private String error;

    public static ImageAnalysisResponse failure(String error) {
        return ImageAnalysisResponse.builder().success(false).error(error).build();
    }
}
