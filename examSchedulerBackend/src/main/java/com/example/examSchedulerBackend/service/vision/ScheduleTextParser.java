package com.example.examSchedulerBackend.service.vision;

import com.example.examSchedulerBackend.model.Batch;
import com.example.examSchedulerBackend.model.Examiner;
import com.example.examSchedulerBackend.model.ExtractedExamData;
import com.example.examSchedulerBackend.model.Semester;
import com.example.examSchedulerBackend.service.RosterFileParser;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the sectioned text a vision model returns for an exam-schedule image.
 * Single-line headers ({@code EXAM_NAME:}, {@code SEMESTER:} ...) carry their
 * value inline; list headers ({@code DATES:}, {@code LABS:} ...) own the lines
 * that follow. Register numbers anywhere in the text are picked up as well.
 */
@Component
public class ScheduleTextParser {

    private static final Pattern LIST_MARKER = Pattern.compile("^(?:\\d+[.)]|[-*\u2022])\\s+");
    private static final Pattern DATE = Pattern.compile("\\d{1,2}[-/]\\d{1,2}[-/]\\d{2,4}");
    private static final Pattern REGISTER_NUMBER_IN_LINE = Pattern.compile("[A-Z]{2,4}\\d{2}[A-Z]{2,3}\\d{3}");

    enum Section {
        DATES, LABS, INTERNAL_EXAMINERS, EXTERNAL_EXAMINERS, SUBJECTS, REGISTER_NUMBERS, RAW_TEXT
    }

    public ParsedSchedule parse(String response) {
        ExtractedExamData data = new ExtractedExamData();
        Set<String> seen = new HashSet<>();
        StringBuilder rawText = new StringBuilder();
        Section current = null;

        for (String rawLine : response.strip().split("\\r?\\n")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            String upper = line.toUpperCase(Locale.ROOT);

            if (upper.startsWith("EXAM_NAME:")) {
                data.setExamName(valueOf(line));
                current = null;
            } else if (upper.startsWith("DEPARTMENT:")) {
                data.setDepartment(valueOf(line));
                current = null;
            } else if (upper.startsWith("SEMESTER:")) {
                String value = valueOf(line);
                if (!value.isEmpty()) {
                    String semester = value.toUpperCase(Locale.ROOT);
                    data.setSemester(semester.startsWith("S") ? semester : "S" + value);
                }
                current = null;
            } else if (upper.startsWith("BATCH:")) {
                String value = valueOf(line);
                if (!value.isEmpty()) {
                    data.setBatch(value.substring(0, 1).toUpperCase(Locale.ROOT));
                }
                current = null;
            } else if (upper.startsWith("ACADEMIC_YEAR:")) {
                data.setAcademicYear(valueOf(line));
                current = null;
            } else if (sectionHeader(upper) != null) {
                current = sectionHeader(upper);
            } else if (current != null) {
                String cleaned = LIST_MARKER.matcher(line).replaceFirst("").trim();
                if (!cleaned.isEmpty()) {
                    addToSection(current, cleaned, data, seen, rawText);
                }
            }
        }
        data.setRawText(rawText.toString());

        Matcher matcher = RosterFileParser.REGISTER_NUMBER.matcher(response.toUpperCase(Locale.ROOT));
        while (matcher.find()) {
            if (seen.add(matcher.group())) {
                data.getRegisterNumbers().add(matcher.group());
            }
        }

        List<Semester> semesters = new ArrayList<>();
        if (!data.getRegisterNumbers().isEmpty()) {
            Batch batch = new Batch(data.getBatch(), new ArrayList<>(data.getRegisterNumbers()));
            semesters.add(new Semester(data.getSemester(), new ArrayList<>(List.of(batch))));
        }
        return new ParsedSchedule(semesters, data);
    }

    private void addToSection(Section section, String cleaned, ExtractedExamData data, Set<String> seen,
                              StringBuilder rawText) {
        switch (section) {
            case DATES: {
                Matcher date = DATE.matcher(cleaned);
                data.getDates().add(date.find() ? date.group().replace('/', '-') : cleaned);
                break;
            }
            case LABS:
                data.getLabs().add(cleaned);
                break;
            case INTERNAL_EXAMINERS:
                data.getInternalExaminers().add(toExaminer(cleaned, "INT", data.getInternalExaminers().size()));
                break;
            case EXTERNAL_EXAMINERS:
                data.getExternalExaminers().add(toExaminer(cleaned, "EXT", data.getExternalExaminers().size()));
                break;
            case SUBJECTS:
                data.getSubjects().add(cleaned);
                break;
            case REGISTER_NUMBERS: {
                Matcher number = REGISTER_NUMBER_IN_LINE.matcher(cleaned.toUpperCase(Locale.ROOT));
                if (number.find() && seen.add(number.group())) {
                    data.getRegisterNumbers().add(number.group());
                }
                break;
            }
            case RAW_TEXT:
                rawText.append(cleaned).append('\n');
                break;
            default:
                break;
        }
    }

    private Examiner toExaminer(String text, String idPrefix, int existing) {
        int colon = text.indexOf(':');
        if (colon >= 0) {
            return new Examiner(text.substring(0, colon).trim(), text.substring(colon + 1).trim());
        }
        return new Examiner(idPrefix + (existing + 1), text);
    }

    private static Section sectionHeader(String upper) {
        for (Section section : Section.values()) {
            if (upper.startsWith(section.name() + ":")) {
                return section;
            }
        }
        return null;
    }

    private static String valueOf(String line) {
        return line.substring(line.indexOf(':') + 1).trim();
    }

    @Value
    public static class ParsedSchedule {
        List<Semester> semesters;
        ExtractedExamData extractedData;

        public List<String> getRegisterNumbers() {
            return extractedData.getRegisterNumbers();
        }
    }
}
