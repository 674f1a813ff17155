package com.example.examSchedulerBackend.model;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExamDate {

    // DD-MM-YY
    @NotNull(message = "Exam date cannot be null")
    private String date;

    private String subject;

    private List<String> registerNumbers = new ArrayList<>();
}
