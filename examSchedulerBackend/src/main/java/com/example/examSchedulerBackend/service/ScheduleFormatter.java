package com.example.examSchedulerBackend.service;

import com.example.examSchedulerBackend.model.ExamMetadata;
import com.example.examSchedulerBackend.model.Examiner;
import com.example.examSchedulerBackend.model.LabSchedule;
import com.example.examSchedulerBackend.model.ScheduleResponse;
import com.example.examSchedulerBackend.model.TimeSlot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ScheduleFormatter {

    private final ObjectMapper objectMapper;

    public ScheduleResponse format(ExamMetadata metadata, List<Examiner> internalExaminers,
                                   List<Examiner> externalExaminers, List<LabSchedule> schedules) {
        Map<String, List<Examiner>> examiners = new LinkedHashMap<>();
        examiners.put("internal", internalExaminers == null ? new ArrayList<>() : internalExaminers);
        examiners.put("external", externalExaminers == null ? new ArrayList<>() : externalExaminers);
        return new ScheduleResponse(metadata, examiners, schedules == null ? new ArrayList<>() : schedules);
    }

    public String toJson(ScheduleResponse response) throws JsonProcessingException {
        return objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(response);
    }

    public ScheduleResponse fromJson(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, ScheduleResponse.class);
    }

    /**
     * Structural problems in a schedule, one message per missing field. Empty
     * when the schedule is well formed.
     */
    public List<String> validateSchema(ScheduleResponse response) {
        List<String> errors = new ArrayList<>();
        List<LabSchedule> schedule = response.getSchedule();
        if (schedule == null) {
            return errors;
        }
        for (int i = 0; i < schedule.size(); i++) {
            LabSchedule lab = schedule.get(i);
            if (isBlank(lab.getDate())) {
                errors.add("Missing schedule[" + i + "].date");
            }
            if (isBlank(lab.getLab())) {
                errors.add("Missing schedule[" + i + "].lab");
            }
            if (lab.getSlots() == null || lab.getSlots().size() != 2) {
                errors.add("schedule[" + i + "] should have exactly 2 slots");
                continue;
            }
            for (int j = 0; j < lab.getSlots().size(); j++) {
                TimeSlot slot = lab.getSlots().get(j);
                String prefix = "Missing schedule[" + i + "].slots[" + j + "].";
                if (isBlank(slot.getTime())) {
                    errors.add(prefix + "time");
                }
                if (slot.getSession() == null) {
                    errors.add(prefix + "session");
                }
                if (slot.getRegisterNumbers() == null) {
                    errors.add(prefix + "register_numbers");
                }
            }
        }
        return errors;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
