package com.example.examSchedulerBackend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CapacityRequirements {
    private int studentCount;
    private int dailyCapacity;
    private int requiredDays;
    private int availableDates;
    // null when no dates were offered
    private Boolean datesSufficient;
    private Integer additionalDatesNeeded;
}
