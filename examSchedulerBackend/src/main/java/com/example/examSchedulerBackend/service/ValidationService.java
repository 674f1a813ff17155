package com.example.examSchedulerBackend.service;

import com.example.examSchedulerBackend.config.SchedulerProperties;
import com.example.examSchedulerBackend.model.CapacityProfile;
import com.example.examSchedulerBackend.model.ScheduleRequest;
import com.example.examSchedulerBackend.model.ValidationError;
import com.example.examSchedulerBackend.model.ValidationResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks a schedule request before allocation. Only a missing roster and
 * malformed dates are errors; everything else is defaulted and reported as a
 * warning.
 */
@Service
@RequiredArgsConstructor
public class ValidationService {

    static final String FIELD_REGISTER_NUMBERS = "register_numbers";
    static final String FIELD_DATES = "dates";

    private final RegisterNumberParser registerNumberParser;
    private final ExamDateParser dateParser;
    private final CapacityProfile capacityProfile;
    private final SchedulerProperties properties;

    public ValidationResult validate(ScheduleRequest request) {
        List<ValidationError> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        List<String> registerNumbers = registerNumberParser
                .removeDuplicates(request.resolveRegisterNumbers()).getUnique();

        validateRegisterNumbers(registerNumbers).ifPresent(errors::add);

        if (isEmpty(request.getLabs())) {
            warnings.add("Using default labs: " + String.join(", ", properties.getDefaultLabs()));
        }
        if (isEmpty(request.getInternalExaminers())) {
            warnings.add("No internal examiners provided. Schedule will be generated without examiner assignments.");
        }
        if (isEmpty(request.getExternalExaminers())) {
            warnings.add("No external examiners provided. Schedule will be generated without examiner assignments.");
        }

        if (!registerNumbers.isEmpty()) {
            List<String> dates = dateParser.sortChronologically(request.resolveDates());
            validateDates(dates, errors, warnings, registerNumbers.size());
        }
        return new ValidationResult(errors, warnings);
    }

    public List<String> resolveLabs(List<String> labs) {
        return isEmpty(labs) ? new ArrayList<>(properties.getDefaultLabs()) : labs;
    }

    public int calculateRequiredDates(int studentCount) {
        return capacityProfile.requiredDays(studentCount);
    }

    public int calculateAdditionalDatesNeeded(int studentCount, int providedDates) {
        return Math.max(0, calculateRequiredDates(studentCount) - providedDates);
    }

    Optional<ValidationError> validateRegisterNumbers(List<String> registerNumbers) {
        if (registerNumbers.isEmpty()) {
            return Optional.of(new ValidationError(FIELD_REGISTER_NUMBERS,
                    "At least one register number is required to generate a schedule"));
        }
        return Optional.empty();
    }

    private void validateDates(List<String> dates, List<ValidationError> errors, List<String> warnings,
                               int studentCount) {
        if (dates.isEmpty()) {
            warnings.add("No dates provided. Please add exam dates for scheduling.");
            return;
        }
        for (String date : dates) {
            if (!dateParser.isValid(date)) {
                errors.add(new ValidationError(FIELD_DATES, "Invalid date format: " + date + ". Expected DD-MM-YY"));
                return;
            }
        }
        if (calculateAdditionalDatesNeeded(studentCount, dates.size()) > 0) {
            warnings.add(String.format("Note: %d students may need %d dates. You provided %d.",
                    studentCount, calculateRequiredDates(studentCount), dates.size()));
        }
    }

    private static boolean isEmpty(List<?> list) {
        return list == null || list.isEmpty();
    }
}
