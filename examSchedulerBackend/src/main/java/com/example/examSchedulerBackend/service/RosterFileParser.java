package com.example.examSchedulerBackend.service;

import com.example.examSchedulerBackend.model.Batch;
import com.example.examSchedulerBackend.model.Semester;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a semester/batch roster out of loosely structured CSV or free text.
 */
@Component
public class RosterFileParser {

    public static final String DEFAULT_SEMESTER = "S1";
    public static final String DEFAULT_BATCH = "A";

    // e.g. TVE20CS001
    public static final Pattern REGISTER_NUMBER = Pattern.compile("\\b[A-Z]{2,4}\\d{2}[A-Z]{2,3}\\d{3}\\b");

    private static final Pattern SEMESTER_HINT = Pattern.compile("(?:semester|sem)[:\\s]*(S?\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern BATCH_HINT = Pattern.compile("(?:batch|division|div)[:\\s]*([A-Z])", Pattern.CASE_INSENSITIVE);
    private static final String[] HEADER_HINTS = {"semester", "batch", "register", "roll"};

    /**
     * Rows of {@code semester,batch,register}, {@code semester,register} or a
     * bare register number, comma or tab separated, with an optional header row.
     */
    public List<Semester> parseCsv(String content) {
        RosterBuilder roster = new RosterBuilder();
        if (content == null || content.isBlank()) {
            return roster.build();
        }
        List<String> lines = new ArrayList<>(List.of(content.strip().split("\\r?\\n")));
        String firstLine = lines.get(0).trim();

        if (looksLikeHeader(firstLine)) {
            lines.remove(0);
        }
        String delimiter = firstLine.contains(",") ? "," : firstLine.contains("\t") ? "\t" : null;

        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (delimiter == null) {
                roster.add(DEFAULT_SEMESTER, DEFAULT_BATCH, line);
                continue;
            }
            String[] parts = line.split(Pattern.quote(delimiter), -1);
            for (int i = 0; i < parts.length; i++) {
                parts[i] = parts[i].trim();
            }
            if (parts.length >= 3) {
                roster.add(parts[0].toUpperCase(Locale.ROOT), parts[1].toUpperCase(Locale.ROOT), parts[2]);
            } else if (parts.length == 2) {
                roster.add(parts[0].toUpperCase(Locale.ROOT), DEFAULT_BATCH, parts[1]);
            } else {
                roster.add(DEFAULT_SEMESTER, DEFAULT_BATCH, parts[0]);
            }
        }
        return roster.build();
    }

    /**
     * Scans free text for register-number-shaped tokens and semester/batch
     * hints. Returns an empty list when no register number is found.
     */
    public List<Semester> extractFromText(String text) {
        List<String> found = findRegisterNumbers(text);
        if (found.isEmpty()) {
            return new ArrayList<>();
        }
        Matcher semesterMatch = SEMESTER_HINT.matcher(text);
        Matcher batchMatch = BATCH_HINT.matcher(text);
        String semester = semesterMatch.find() ? normaliseSemester(semesterMatch.group(1)) : DEFAULT_SEMESTER;
        String batch = batchMatch.find() ? batchMatch.group(1).toUpperCase(Locale.ROOT) : DEFAULT_BATCH;

        List<String> unique = new ArrayList<>(new LinkedHashSet<>(found));
        List<Semester> semesters = new ArrayList<>();
        semesters.add(new Semester(semester, new ArrayList<>(List.of(new Batch(batch, unique)))));
        return semesters;
    }

    /**
     * Every non-blank line as a register number under the default semester and batch.
     */
    public List<Semester> parsePlainList(String text) {
        RosterBuilder roster = new RosterBuilder();
        if (text != null) {
            for (String line : text.strip().split("\\r?\\n")) {
                if (!line.isBlank()) {
                    roster.add(DEFAULT_SEMESTER, DEFAULT_BATCH, line.trim());
                }
            }
        }
        return roster.build();
    }

    public List<String> findRegisterNumbers(String text) {
        List<String> found = new ArrayList<>();
        if (text == null) {
            return found;
        }
        Matcher matcher = REGISTER_NUMBER.matcher(text.toUpperCase(Locale.ROOT));
        while (matcher.find()) {
            found.add(matcher.group());
        }
        return found;
    }

    public static int countStudents(List<Semester> semesters) {
        int total = 0;
        for (Semester semester : semesters) {
            total += semester.getAllRegisterNumbers().size();
        }
        return total;
    }

    static String normaliseSemester(String name) {
        String upper = name.trim().toUpperCase(Locale.ROOT);
        return upper.startsWith("S") ? upper : "S" + upper;
    }

    private static boolean looksLikeHeader(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        for (String hint : HEADER_HINTS) {
            if (lower.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Collects register numbers per semester and batch; names come out sorted,
     * numbers keep first-seen order without repeats inside a batch.
     */
    static class RosterBuilder {
        private final Map<String, Map<String, LinkedHashSet<String>>> bySemester = new TreeMap<>();

        void add(String semester, String batch, String registerNumber) {
            if (registerNumber == null || registerNumber.isEmpty()) {
                return;
            }
            bySemester.computeIfAbsent(normaliseSemester(semester), k -> new TreeMap<>())
                    .computeIfAbsent(batch, k -> new LinkedHashSet<>())
                    .add(registerNumber);
        }

        List<Semester> build() {
            List<Semester> semesters = new ArrayList<>();
            bySemester.forEach((semesterName, batches) -> {
                List<Batch> batchList = new ArrayList<>();
                batches.forEach((batchName, numbers) -> batchList.add(new Batch(batchName, new ArrayList<>(numbers))));
                semesters.add(new Semester(semesterName, batchList));
            });
            return semesters;
        }
    }
}
