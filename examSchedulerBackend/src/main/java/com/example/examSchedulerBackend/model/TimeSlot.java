package com.example.examSchedulerBackend.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimeSlot {

    private String time;

    @NotNull
    private Session session;

    // number of candidates actually seated in this slot
    @Min(0)
    private int capacity;

    private List<String> registerNumbers = new ArrayList<>();
}
