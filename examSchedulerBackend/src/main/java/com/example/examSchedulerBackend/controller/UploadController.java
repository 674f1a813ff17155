package com.example.examSchedulerBackend.controller;

import com.example.examSchedulerBackend.model.ImageAnalysisResponse;
import com.example.examSchedulerBackend.model.RosterParseResult;
import com.example.examSchedulerBackend.service.UploadService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

@Slf4j
@RestController
@RequestMapping("/api/upload")
@CrossOrigin(origins = "${cors.allowed-origins:*}")
@RequiredArgsConstructor
public class UploadController {

    private final UploadService uploadService;

    @PostMapping("/parse-file")
    public ResponseEntity<RosterParseResult> parseFile(@RequestParam("file") MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            return ResponseEntity.badRequest().body(RosterParseResult.builder()
                    .success(false)
                    .error("No file uploaded or file is empty.")
                    .build());
        }
        return ResponseEntity.ok(uploadService.parseRoster(file.getOriginalFilename(), file.getBytes()));
    }

    @PostMapping("/analyze-image")
    public CompletableFuture<ResponseEntity<ImageAnalysisResponse>> analyzeImage(@RequestParam("file") MultipartFile file)
            throws IOException {
        if (file == null || file.isEmpty()) {
            return CompletableFuture.completedFuture(ResponseEntity.badRequest()
                    .body(ImageAnalysisResponse.failure("No file uploaded or file is empty.")));
        }
        log.info("Analysing image {} ({} bytes)", file.getOriginalFilename(), file.getSize());
        return uploadService.analyzeImage(file.getBytes(), file.getContentType())
                .thenApply(response -> ResponseEntity.ok(response));
    }
}
