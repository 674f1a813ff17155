package com.example.examSchedulerBackend.service;

import com.example.examSchedulerBackend.config.VisionProperties;
import com.example.examSchedulerBackend.model.ImageAnalysisResponse;
import com.example.examSchedulerBackend.model.RosterParseResult;
import com.example.examSchedulerBackend.model.Semester;
import com.example.examSchedulerBackend.service.vision.ImageAnalysisResult;
import com.example.examSchedulerBackend.service.vision.ImageAnalysisService;
import com.example.examSchedulerBackend.service.vision.ScheduleTextParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Turns uploaded rosters and schedule images into the semester structure the
 * scheduler accepts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadService {

    public static final String TIMED_OUT = "Image analysis timed out. Please try again or use a different image.";

    private final RosterFileParser rosterFileParser;
    private final RosterExcelService rosterExcelService;
    private final ImageAnalysisService imageAnalysisService;
    private final ScheduleTextParser scheduleTextParser;
    private final VisionProperties visionProperties;

    public RosterParseResult parseRoster(String filename, byte[] content) {
        try {
            List<Semester> semesters;
            if (isExcel(filename)) {
                semesters = rosterExcelService.readRoster(new ByteArrayInputStream(content));
            } else {
                String text = new String(content, StandardCharsets.UTF_8);
                if ((filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".csv")) || text.contains(",")) {
                    semesters = rosterFileParser.parseCsv(text);
                } else {
                    semesters = rosterFileParser.extractFromText(text);
                }
                if (semesters.isEmpty()) {
                    semesters = rosterFileParser.parsePlainList(text);
                }
            }

            int total = RosterFileParser.countStudents(semesters);
            log.info("Parsed roster {}: {} register numbers in {} semester(s)", filename, total, semesters.size());
            return RosterParseResult.builder()
                    .success(true)
                    .semesters(semesters)
                    .totalStudents(total)
                    .message("Extracted " + total + " register numbers from " + semesters.size() + " semester(s)")
                    .build();
        } catch (IOException | RuntimeException e) {
            log.warn("Could not parse roster {}", filename, e);
            return RosterParseResult.builder()
                    .success(false)
                    .totalStudents(0)
                    .error(e.getMessage())
                    .build();
        }
    }

    public CompletableFuture<ImageAnalysisResponse> analyzeImage(byte[] image, String contentType) {
        if (!visionProperties.isConfigured()) {
            return CompletableFuture.completedFuture(ImageAnalysisResponse.failure(
                    "Image analysis is not configured on the server. Please contact the administrator."));
        }
        String mimeType = contentType == null ? "image/png" : contentType.toLowerCase(Locale.ROOT);
        if (!visionProperties.getAllowedMimeTypes().contains(mimeType)) {
            return CompletableFuture.completedFuture(ImageAnalysisResponse.failure(
                    "Invalid image format. Supported formats: PNG, JPG, JPEG. Got: " + mimeType));
        }

        CompletableFuture<ImageAnalysisResult> analysis = imageAnalysisService.analyze(image, mimeType);
        return analysis.thenApply(result -> {
            if (!result.isAvailable()) {
                return ImageAnalysisResponse.failure(
                        "Failed to analyze image. Please try again or use a different image.");
            }
            ScheduleTextParser.ParsedSchedule parsed = scheduleTextParser.parse(result.getText());
            int total = parsed.getRegisterNumbers().size();
            return ImageAnalysisResponse.builder()
                    .success(true)
                    .semesters(parsed.getSemesters())
                    .totalStudents(total)
                    .extractedData(parsed.getExtractedData())
                    .rawResponse(result.getText())
                    .message("Extracted " + total + " register numbers and additional exam data using "
                            + result.getBackend())
                    .build();
        }).completeOnTimeout(ImageAnalysisResponse.failure(TIMED_OUT),
                visionProperties.getOverallTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((response, error) -> analysis.cancel(true));
    }

    private static boolean isExcel(String filename) {
        if (filename == null) {
            return false;
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        return lower.endsWith(".xls") || lower.endsWith(".xlsx");
    }
}
