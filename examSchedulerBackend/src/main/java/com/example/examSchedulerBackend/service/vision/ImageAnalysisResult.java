package com.example.examSchedulerBackend.service.vision;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Outcome of reading one image: the text and the backend that produced it, or
 * the reason nothing could.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ImageAnalysisResult {
    boolean available;
    String backend;
    String text;
    List<String> failures;

    public static ImageAnalysisResult success(String backend, String text, List<String> failures) {
        return new ImageAnalysisResult(true, backend, text, List.copyOf(failures));
    }

    public static ImageAnalysisResult unavailable(List<String> failures) {
        return new ImageAnalysisResult(false, null, null, List.copyOf(failures));
    }
}
