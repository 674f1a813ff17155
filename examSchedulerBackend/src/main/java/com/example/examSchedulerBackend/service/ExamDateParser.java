package com.example.examSchedulerBackend.service;

import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Reads and orders exam dates written as DD-MM-YY.
 */
@Component
public class ExamDateParser {

    // two-digit years map onto 1969..2068
    private static final DateTimeFormatter FORMAT = new DateTimeFormatterBuilder()
            .appendValue(ChronoField.DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE)
            .appendLiteral('-')
            .appendValue(ChronoField.MONTH_OF_YEAR, 1, 2, SignStyle.NOT_NEGATIVE)
            .appendLiteral('-')
            .appendValueReduced(ChronoField.YEAR, 2, 2, 1969)
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter OUTPUT = DateTimeFormatter.ofPattern("dd-MM-yy");

    public LocalDate parse(String text) {
        if (text == null) {
            throw new DateTimeParseException("Date is missing", "", 0);
        }
        return LocalDate.parse(text.trim(), FORMAT);
    }

    public Optional<LocalDate> tryParse(String text) {
        try {
            return Optional.of(parse(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public boolean isValid(String text) {
        return tryParse(text).isPresent();
    }

    public String format(LocalDate date) {
        return date.format(OUTPUT);
    }

    public long daysBetween(String first, String second) {
        return Math.abs(ChronoUnit.DAYS.between(parse(first), parse(second)));
    }

    /**
     * Trims and sorts the tokens chronologically. Tokens that do not parse are
     * kept and placed after every real date, in their original order, so that
     * validation can report them later.
     */
    public List<String> sortChronologically(List<String> dates) {
        List<ParsedDate> parsed = new ArrayList<>();
        if (dates == null) {
            return new ArrayList<>();
        }
        for (String raw : dates) {
            if (raw == null) {
                continue;
            }
            String token = raw.trim();
            parsed.add(new ParsedDate(token, tryParse(token).orElse(LocalDate.MAX)));
        }
        // List.sort is stable, so equal keys keep input order
        parsed.sort(Comparator.comparing(ParsedDate::getDate));

        List<String> result = new ArrayList<>(parsed.size());
        for (ParsedDate p : parsed) {
            result.add(p.getToken());
        }
        return result;
    }

    public String join(List<String> dates) {
        return String.join(", ", dates);
    }

    @Value
    private static class ParsedDate {
        String token;
        LocalDate date;
    }
}
