package com.example.examSchedulerBackend.service;

import com.example.examSchedulerBackend.config.SchedulerProperties;
import com.example.examSchedulerBackend.model.AllocationInput;
import com.example.examSchedulerBackend.model.ApiResponse;
import com.example.examSchedulerBackend.model.DeduplicationResult;
import com.example.examSchedulerBackend.model.ExamDate;
import com.example.examSchedulerBackend.model.LabSchedule;
import com.example.examSchedulerBackend.model.ScheduleRequest;
import com.example.examSchedulerBackend.model.ScheduleResponse;
import com.example.examSchedulerBackend.model.ValidationReport;
import com.example.examSchedulerBackend.model.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request pipeline: de-duplicate, sort dates, validate, allocate, format.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleService {

    private final RegisterNumberParser registerNumberParser;
    private final ExamDateParser dateParser;
    private final ValidationService validationService;
    private final AllocationService allocationService;
    private final ScheduleFormatter scheduleFormatter;
    private final SchedulerProperties properties;

    public ApiResponse generate(ScheduleRequest request) {
        List<String> warnings = new ArrayList<>();

        DeduplicationResult dedup = registerNumberParser.removeDuplicates(request.resolveRegisterNumbers());
        if (dedup.hasDuplicates()) {
            warnings.add("Duplicate register numbers removed: " + previewDuplicates(dedup.getDuplicates()));
        }

        List<String> dates = dateParser.sortChronologically(request.resolveDates());

        Map<String, String> dateSubjects = new LinkedHashMap<>();
        Map<String, List<String>> dateRegisterNumbers = new LinkedHashMap<>();
        if (request.getExamDates() != null) {
            for (ExamDate examDate : request.getExamDates()) {
                if (examDate.getDate() == null) {
                    continue;
                }
                String date = examDate.getDate().trim();
                if (examDate.getSubject() != null && !examDate.getSubject().isEmpty()) {
                    dateSubjects.put(date, examDate.getSubject());
                }
                if (examDate.getRegisterNumbers() != null && !examDate.getRegisterNumbers().isEmpty()) {
                    dateRegisterNumbers.put(date, examDate.getRegisterNumbers());
                }
            }
        }

        ValidationResult validation = validationService.validate(request);
        warnings.addAll(validation.getWarnings());
        if (!validation.isValid()) {
            log.info("Schedule request rejected with {} error(s)", validation.getErrors().size());
            return ApiResponse.failed(validation.getErrors(), warnings);
        }

        AllocationInput input = AllocationInput.builder()
                .registerNumbers(dedup.getUnique())
                .dates(dates)
                .labs(validationService.resolveLabs(request.getLabs()))
                .internalExaminers(nullToEmpty(request.getInternalExaminers()))
                .externalExaminers(nullToEmpty(request.getExternalExaminers()))
                .semesters(nullToEmpty(request.getSemesters()))
                .dateSubjects(dateSubjects)
                .dateRegisterNumbers(dateRegisterNumbers)
                .build();
        List<LabSchedule> schedules = allocationService.allocate(input);

        int expected = input.isDateKeyed() ? countAll(dateRegisterNumbers) : dedup.getUnique().size();
        int placed = allocationService.flattenRegisterNumbers(schedules).size();
        if (placed < expected) {
            warnings.add((expected - placed) + " register number(s) could not be placed. Add more dates or labs.");
        }

        ScheduleResponse response = scheduleFormatter.format(request.getExamMetadata(),
                request.getInternalExaminers(), request.getExternalExaminers(), schedules);
        log.info("Generated {} lab schedules for {} students over {} date(s)", schedules.size(), placed, dates.size());
        return ApiResponse.ok(response, warnings);
    }

    public ValidationReport validate(ScheduleRequest request) {
        List<String> warnings = new ArrayList<>();

        DeduplicationResult dedup = registerNumberParser.removeDuplicates(request.resolveRegisterNumbers());
        if (dedup.hasDuplicates()) {
            warnings.add("Duplicate register numbers found: " + previewDuplicates(dedup.getDuplicates()));
        }

        ValidationResult validation = validationService.validate(request);
        warnings.addAll(validation.getWarnings());

        ValidationReport.Summary summary = ValidationReport.Summary.builder()
                .totalStudents(dedup.getUnique().size())
                .duplicatesFound(dedup.getDuplicates().size())
                .datesProvided(request.resolveDates().size())
                .labsProvided(sizeOf(request.getLabs()))
                .internalExaminers(sizeOf(request.getInternalExaminers()))
                .externalExaminers(sizeOf(request.getExternalExaminers()))
                .semesters(sizeOf(request.getSemesters()))
                .build();
        return new ValidationReport(validation.isValid(), validation.getErrors(), warnings, summary);
    }

    String previewDuplicates(List<String> duplicates) {
        int limit = properties.getDuplicatePreviewLimit();
        if (duplicates.size() <= limit) {
            return String.join(", ", duplicates);
        }
        return String.join(", ", duplicates.subList(0, limit)) + " and " + (duplicates.size() - limit) + " more";
    }

    private static int countAll(Map<String, List<String>> byDate) {
        int total = 0;
        for (List<String> list : byDate.values()) {
            total += list.size();
        }
        return total;
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? new ArrayList<>() : list;
    }
}
