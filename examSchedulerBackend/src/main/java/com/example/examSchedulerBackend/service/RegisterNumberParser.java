package com.example.examSchedulerBackend.service;

import com.example.examSchedulerBackend.model.DeduplicationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns pasted text and single-column CSV into ordered register-number lists,
 * and strips repeats.
 */
@Component
public class RegisterNumberParser {

    private static final Pattern TEXT_SEPARATORS = Pattern.compile("[\\r\\n,]+|\\s{2,}");

    private static final Set<String> HEADER_WORDS = Set.of("register_number", "reg_no", "regno", "register number");

    public List<String> parseText(String text) {
        List<String> result = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return result;
        }
        for (String part : TEXT_SEPARATORS.split(text)) {
            String cleaned = part.trim();
            if (!cleaned.isEmpty()) {
                result.add(cleaned);
            }
        }
        return result;
    }

    public String formatText(List<String> registerNumbers) {
        return String.join("\n", registerNumbers);
    }

    /**
     * First column of every row, skipping a header row and blank cells.
     */
    public List<String> parseCsv(String content) {
        List<String> result = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return result;
        }
        for (String line : content.split("\\r?\\n")) {
            if (line.isEmpty()) {
                continue;
            }
            String value = unquote(line.split(",", -1)[0].trim());
            if (!value.isEmpty() && !HEADER_WORDS.contains(value.toLowerCase(Locale.ROOT))) {
                result.add(value);
            }
        }
        return result;
    }

    public String formatCsv(List<String> registerNumbers) {
        StringBuilder out = new StringBuilder();
        for (String registerNumber : registerNumbers) {
            out.append(quoteIfNeeded(registerNumber)).append("\r\n");
        }
        return out.toString();
    }

    public DeduplicationResult removeDuplicates(List<String> registerNumbers) {
        Set<String> seen = new HashSet<>();
        List<String> unique = new ArrayList<>();
        List<String> duplicates = new ArrayList<>();
        for (String registerNumber : registerNumbers) {
            if (seen.add(registerNumber)) {
                unique.add(registerNumber);
            } else {
                duplicates.add(registerNumber);
            }
        }
        return new DeduplicationResult(unique, duplicates);
    }

    private String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).replace("\"\"", "\"").trim();
        }
        return value;
    }

    private String quoteIfNeeded(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
