package com.example.examSchedulerBackend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Semester {

    @NotBlank(message = "Semester name cannot be blank")
    private String name;

    @Valid
    private List<Batch> batches = new ArrayList<>();

    @JsonIgnore
    public List<String> getAllRegisterNumbers() {
        List<String> all = new ArrayList<>();
        if (batches == null) {
            return all;
        }
        for (Batch batch : batches) {
            if (batch != null && batch.getRegisterNumbers() != null) {
                all.addAll(batch.getRegisterNumbers());
            }
        }
        return all;
    }

    /**
     * Full label of a batch within this semester, e.g. "S1" + "A" gives "S1A".
     */
    public String getBatchLabel(String batchName) {
        return name + batchName;
    }
}
