package com.example.examSchedulerBackend.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything the allocation engine reads. When {@code dateRegisterNumbers} is
 * non-empty each date draws from its own list; otherwise all dates share
 * {@code registerNumbers}.
 */
@Value
@Builder
public class AllocationInput {
    @Builder.Default
    List<String> registerNumbers = List.of();
    @Builder.Default
    List<String> dates = List.of();
    @Builder.Default
    List<String> labs = List.of();
    @Builder.Default
    List<Examiner> internalExaminers = List.of();
    @Builder.Default
    List<Examiner> externalExaminers = List.of();
    @Builder.Default
    List<Semester> semesters = List.of();
    @Builder.Default
    Map<String, String> dateSubjects = Map.of();
    @Builder.Default
    Map<String, List<String>> dateRegisterNumbers = Map.of();

    public boolean isDateKeyed() {
        return dateRegisterNumbers != null && !dateRegisterNumbers.isEmpty();
    }
}
