package com.example.examSchedulerBackend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One lab on one exam date. {@code slots} always holds exactly two entries,
 * forenoon first.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LabSchedule {

    private String date;
    private String subject;
    private String lab;
    private List<TimeSlot> slots = new ArrayList<>();
    private Examiner internalExaminer;
    private Examiner externalExaminer;
    private String semester;
    private String batch;

    @JsonIgnore
    public int getStudentCount() {
        int total = 0;
        for (TimeSlot slot : slots) {
            total += slot.getRegisterNumbers().size();
        }
        return total;
    }
}
