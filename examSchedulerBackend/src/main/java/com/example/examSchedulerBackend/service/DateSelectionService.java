package com.example.examSchedulerBackend.service;

import com.example.examSchedulerBackend.model.CapacityProfile;
import com.example.examSchedulerBackend.model.CapacityRequirements;
import com.example.examSchedulerBackend.model.DateSelection;
import com.example.examSchedulerBackend.model.ExamDate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks the fewest exam days that can seat every candidate from a pool of
 * available dates, keeping a minimum gap between chosen days where the pool
 * allows it. Never fails: shortfalls and relaxed gaps are reported in the
 * returned message.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DateSelectionService {

    private final ExamDateParser dateParser;
    private final CapacityProfile capacityProfile;

    public int requiredDays(int studentCount) {
        return capacityProfile.requiredDays(studentCount);
    }

    public int dailyCapacity() {
        return capacityProfile.getDailyCapacity();
    }

    public DateSelection selectOptimalDates(List<String> availableDates, int studentCount, int minGapDays) {
        return selectOptimalDates(availableDates, studentCount, minGapDays, capacityProfile);
    }

    public DateSelection selectOptimalDates(List<String> availableDates, int studentCount, int minGapDays,
                                            CapacityProfile profile) {
        int requiredDays = profile.requiredDays(studentCount);
        if (availableDates == null || availableDates.isEmpty()) {
            return new DateSelection(new ArrayList<>(), "No dates provided", requiredDays);
        }
        if (requiredDays == 0) {
            return new DateSelection(new ArrayList<>(), "No students to schedule", requiredDays);
        }

        List<String> sorted = dateParser.sortChronologically(availableDates);
        int received = sorted.size();
        sorted.removeIf(token -> !dateParser.isValid(token));
        if (sorted.size() < received) {
            log.warn("Ignored {} unparseable date(s) in the selection pool", received - sorted.size());
        }
        if (sorted.isEmpty()) {
            return new DateSelection(new ArrayList<>(), "No valid dates provided", requiredDays);
        }

        if (sorted.size() < requiredDays) {
            log.warn("Only {} dates available for {} students, {} needed", sorted.size(), studentCount, requiredDays);
            return new DateSelection(sorted, String.format("Warning: Only %d dates available, need %d for %d students",
                    sorted.size(), requiredDays, studentCount), requiredDays);
        }

        if (requiredDays == 1) {
            return new DateSelection(new ArrayList<>(sorted.subList(0, 1)),
                    "Selected 1 date for " + studentCount + " students", requiredDays);
        }

        List<String> selected;
        if (minGapDays <= 1) {
            selected = new ArrayList<>(sorted.subList(0, requiredDays));
        } else {
            selected = walkWithGap(sorted, requiredDays, minGapDays);
            if (selected.size() < requiredDays) {
                log.info("Gap of {} days not achievable for {} dates, relaxing", minGapDays, requiredDays);
                selected = new ArrayList<>(sorted.subList(0, requiredDays));
                return new DateSelection(selected, "Selected " + selected.size()
                        + " dates (gap constraint relaxed due to limited dates)", requiredDays);
            }
        }

        StringBuilder message = new StringBuilder()
                .append("Selected ").append(selected.size()).append(" dates for ").append(studentCount).append(" students");
        averageGap(selected).ifPresent(avg ->
                message.append(String.format(Locale.ROOT, " (avg gap: %.1f days)", avg)));
        log.info("Selected exam dates {} for {} students", selected, studentCount);
        return new DateSelection(selected, message.toString(), requiredDays);
    }

    /**
     * Selected dates paired with subjects in order; dates beyond the subject
     * list get no subject.
     */
    public List<ExamDate> toExamDates(List<String> selectedDates, List<String> subjects) {
        List<ExamDate> examDates = new ArrayList<>();
        for (int i = 0; i < selectedDates.size(); i++) {
            String subject = subjects != null && i < subjects.size() ? subjects.get(i) : null;
            examDates.add(new ExamDate(selectedDates.get(i), subject, new ArrayList<>()));
        }
        return examDates;
    }

    public CapacityRequirements calculateRequirements(int studentCount, int availableDates) {
        int required = capacityProfile.requiredDays(studentCount);
        boolean offered = availableDates > 0;
        return CapacityRequirements.builder()
                .studentCount(studentCount)
                .dailyCapacity(capacityProfile.getDailyCapacity())
                .requiredDays(required)
                .availableDates(availableDates)
                .datesSufficient(offered ? availableDates >= required : null)
                .additionalDatesNeeded(offered ? Math.max(0, required - availableDates) : null)
                .build();
    }

    private List<String> walkWithGap(List<String> sorted, int requiredDays, int minGapDays) {
        List<String> selected = new ArrayList<>();
        LocalDate last = null;
        for (String token : sorted) {
            if (selected.size() >= requiredDays) {
                break;
            }
            Optional<LocalDate> parsed = dateParser.tryParse(token);
            if (parsed.isEmpty()) {
                continue;
            }
            LocalDate date = parsed.get();
            if (last == null || ChronoUnit.DAYS.between(last, date) >= minGapDays) {
                selected.add(token);
                last = date;
            }
        }
        return selected;
    }

    private Optional<Double> averageGap(List<String> selected) {
        long total = 0;
        int count = 0;
        for (int i = 1; i < selected.size(); i++) {
            Optional<LocalDate> previous = dateParser.tryParse(selected.get(i - 1));
            Optional<LocalDate> current = dateParser.tryParse(selected.get(i));
            if (previous.isPresent() && current.isPresent()) {
                total += Math.abs(ChronoUnit.DAYS.between(previous.get(), current.get()));
                count++;
            }
        }
        return count == 0 ? Optional.empty() : Optional.of((double) total / count);
    }
}
