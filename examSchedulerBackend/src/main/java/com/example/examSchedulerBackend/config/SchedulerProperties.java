package com.example.examSchedulerBackend.config;

import com.example.examSchedulerBackend.model.CapacityProfile;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private int studentsPerLab = 25;
    private int forenoonCapacity = 13;
    private int afternoonCapacity = 12;
    private int labsPerDay = 5;
    private String forenoonTime = "09:30 am - 12:30 pm";
    private String afternoonTime = "01:30 pm - 04:30 pm";
    private List<String> defaultLabs = new ArrayList<>(List.of("Lab 1", "Lab 2", "Lab 3", "Lab 4", "Lab 5"));

    // how many duplicate register numbers are spelled out in a warning
    private int duplicatePreviewLimit = 10;

    public CapacityProfile toCapacityProfile() {
        try {
            return CapacityProfile.builder()
                    .studentsPerLab(studentsPerLab)
                    .forenoonCapacity(forenoonCapacity)
                    .afternoonCapacity(afternoonCapacity)
                    .labsPerDay(labsPerDay)
                    .forenoonTime(forenoonTime)
                    .afternoonTime(afternoonTime)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid scheduler.* capacity settings: " + e.getMessage(), e);
        }
    }
}
