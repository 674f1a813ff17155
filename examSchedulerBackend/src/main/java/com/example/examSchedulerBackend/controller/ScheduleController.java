package com.example.examSchedulerBackend.controller;

import com.example.examSchedulerBackend.model.ApiResponse;
import com.example.examSchedulerBackend.model.CapacityRequirements;
import com.example.examSchedulerBackend.model.DateSelection;
import com.example.examSchedulerBackend.model.DateSelectionRequest;
import com.example.examSchedulerBackend.model.DateSelectionResponse;
import com.example.examSchedulerBackend.model.ScheduleRequest;
import com.example.examSchedulerBackend.model.ValidationError;
import com.example.examSchedulerBackend.model.ValidationReport;
import com.example.examSchedulerBackend.service.DateSelectionService;
import com.example.examSchedulerBackend.service.ExamDateParser;
import com.example.examSchedulerBackend.service.ScheduleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "${cors.allowed-origins:*}")
@RequiredArgsConstructor
public class ScheduleController {

    private final ScheduleService scheduleService;
    private final DateSelectionService dateSelectionService;
    private final ExamDateParser dateParser;

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", "exam-scheduler");
        return ResponseEntity.ok(body);
    }

    @PostMapping("/schedule/generate")
    public ResponseEntity<ApiResponse> generate(@Valid @RequestBody ScheduleRequest request) {
        return ResponseEntity.ok(scheduleService.generate(request));
    }

    @PostMapping("/schedule/validate")
    public ResponseEntity<ValidationReport> validate(@Valid @RequestBody ScheduleRequest request) {
        return ResponseEntity.ok(scheduleService.validate(request));
    }

    @PostMapping("/schedule/auto-select-dates")
    public ResponseEntity<DateSelectionResponse> autoSelectDates(@Valid @RequestBody DateSelectionRequest request) {
        for (String date : request.getAvailableDates()) {
            if (!dateParser.isValid(date)) {
                String message = "Invalid date format: " + date + ". Expected DD-MM-YY";
                List<ValidationError> errors = new ArrayList<>();
                errors.add(new ValidationError("available_dates", message));
                return ResponseEntity.badRequest().body(DateSelectionResponse.builder()
                        .success(false)
                        .selectedDates(new ArrayList<>())
                        .examDates(new ArrayList<>())
                        .availableDays(request.getAvailableDates().size())
                        .message(message)
                        .errors(errors)
                        .build());
            }
        }
        List<String> sorted = dateParser.sortChronologically(request.getAvailableDates());
        DateSelection selection = dateSelectionService.selectOptimalDates(
                sorted, request.getStudentCount(), request.getMinGapDays());

        DateSelectionResponse response = DateSelectionResponse.builder()
                .success(true)
                .selectedDates(selection.getSelectedDates())
                .examDates(dateSelectionService.toExamDates(selection.getSelectedDates(), request.getSubjects()))
                .requiredDays(selection.getRequiredDays())
                .availableDays(request.getAvailableDates().size())
                .studentsPerDay(dateSelectionService.dailyCapacity())
                .message(selection.getMessage())
                .scheduleInfo(DateSelectionResponse.ScheduleInfo.builder()
                        .totalStudents(request.getStudentCount())
                        .daysNeeded(selection.getRequiredDays())
                        .daysSelected(selection.getSelectedDates().size())
                        .minGapRequested(request.getMinGapDays())
                        .build())
                .build();
        return ResponseEntity.ok(response);
    }

    @PostMapping("/schedule/calculate-requirements")
    public ResponseEntity<CapacityRequirements> calculateRequirements(
            @RequestParam("student_count") int studentCount,
            @RequestParam(value = "available_dates", defaultValue = "0") int availableDates) {
        return ResponseEntity.ok(dateSelectionService.calculateRequirements(studentCount, availableDates));
    }
}
