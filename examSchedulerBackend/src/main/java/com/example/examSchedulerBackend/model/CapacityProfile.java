package com.example.examSchedulerBackend.model;

import lombok.Builder;
import lombok.Value;

/**
 * Seating limits for one allocation run. Forenoon and afternoon capacities
 * must add up to {@code studentsPerLab}.
 */
@Value
public class CapacityProfile {

    public static final CapacityProfile STANDARD = CapacityProfile.builder().build();

    int studentsPerLab;
    int forenoonCapacity;
    int afternoonCapacity;
    int labsPerDay;
    String forenoonTime;
    String afternoonTime;

    @Builder
    public CapacityProfile(int studentsPerLab, int forenoonCapacity, int afternoonCapacity, int labsPerDay,
                           String forenoonTime, String afternoonTime) {
        if (studentsPerLab <= 0 || labsPerDay <= 0) {
            throw new IllegalArgumentException("studentsPerLab and labsPerDay must be positive, got "
                    + studentsPerLab + " and " + labsPerDay);
        }
        if (forenoonCapacity < 0 || afternoonCapacity < 0
                || forenoonCapacity + afternoonCapacity != studentsPerLab) {
            throw new IllegalArgumentException("forenoonCapacity + afternoonCapacity must equal studentsPerLab, got "
                    + forenoonCapacity + " + " + afternoonCapacity + " != " + studentsPerLab);
        }
        this.studentsPerLab = studentsPerLab;
        this.forenoonCapacity = forenoonCapacity;
        this.afternoonCapacity = afternoonCapacity;
        this.labsPerDay = labsPerDay;
        this.forenoonTime = forenoonTime;
        this.afternoonTime = afternoonTime;
    }

    public int getDailyCapacity() {
        return studentsPerLab * labsPerDay;
    }

    /**
     * Exam days needed to seat {@code studentCount} candidates; zero when there
     * is nobody to seat.
     */
    public int requiredDays(int studentCount) {
        if (studentCount <= 0) {
            return 0;
        }
        int daily = getDailyCapacity();
        return (studentCount + daily - 1) / daily;
    }

    // defaults for fields the caller leaves unset
    public static class CapacityProfileBuilder {
        private int studentsPerLab = 25;
        private int forenoonCapacity = 13;
        private int afternoonCapacity = 12;
        private int labsPerDay = 5;
        private String forenoonTime = "09:30 am - 12:30 pm";
        private String afternoonTime = "01:30 pm - 04:30 pm";
    }
}
