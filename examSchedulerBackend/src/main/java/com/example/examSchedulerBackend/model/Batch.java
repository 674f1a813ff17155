package com.example.examSchedulerBackend.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Batch {

    @NotBlank(message = "Batch name cannot be blank")
    private String name;

    private List<String> registerNumbers = new ArrayList<>();
}
