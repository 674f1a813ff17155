package com.example.examSchedulerBackend.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Examiner {

    private static final String SEPARATOR = ": ";

    @NotBlank(message = "Examiner id cannot be blank")
    private String id;

    @NotBlank(message = "Examiner name cannot be blank")
    private String name;

    /**
     * Display form used on printed schedules, e.g. {@code "E01: Dr. Rao"}.
     */
    public String toDisplayString() {
        return id + SEPARATOR + name;
    }

    public static Examiner fromDisplayString(String text) {
        int idx = text == null ? -1 : text.indexOf(SEPARATOR);
        if (idx < 0) {
            throw new IllegalArgumentException("Invalid examiner format: " + text);
        }
        return new Examiner(text.substring(0, idx), text.substring(idx + SEPARATOR.length()));
    }
}
