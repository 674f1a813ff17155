package com.example.examSchedulerBackend.model;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Inputs for schedule generation and validation. Every field is optional;
 * candidates may arrive as per-date lists, as a semester/batch structure, or
 * as the legacy flat list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRequest {

    private ExamMetadata examMetadata;

    @Builder.Default
    private List<String> registerNumbers = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<Semester> semesters = new ArrayList<>();

    @Builder.Default
    private List<String> dates = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<ExamDate> examDates = new ArrayList<>();

    @Builder.Default
    private List<String> labs = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<Examiner> internalExaminers = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<Examiner> externalExaminers = new ArrayList<>();

    /**
     * Candidates in priority order: per-date lists (when any is non-empty),
     * then the semester structure, then the flat list.
     */
    public List<String> resolveRegisterNumbers() {
        if (examDates != null && !examDates.isEmpty()) {
            List<String> all = new ArrayList<>();
            for (ExamDate examDate : examDates) {
                if (examDate.getRegisterNumbers() != null) {
                    all.addAll(examDate.getRegisterNumbers());
                }
            }
            if (!all.isEmpty()) {
                return all;
            }
        }
        if (semesters != null && !semesters.isEmpty()) {
            List<String> all = new ArrayList<>();
            for (Semester semester : semesters) {
                if (semester != null) {
                    all.addAll(semester.getAllRegisterNumbers());
                }
            }
            return all;
        }
        return registerNumbers == null ? new ArrayList<>() : registerNumbers;
    }

    public List<String> resolveDates() {
        if (examDates != null && !examDates.isEmpty()) {
            List<String> result = new ArrayList<>();
            for (ExamDate examDate : examDates) {
                result.add(examDate.getDate());
            }
            return result;
        }
        return dates == null ? new ArrayList<>() : dates;
    }
}
