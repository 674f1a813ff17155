package com.example.examSchedulerBackend.service;

import com.example.examSchedulerBackend.model.AllocationInput;
import com.example.examSchedulerBackend.model.Batch;
import com.example.examSchedulerBackend.model.CapacityProfile;
import com.example.examSchedulerBackend.model.Examiner;
import com.example.examSchedulerBackend.model.LabSchedule;
import com.example.examSchedulerBackend.model.Semester;
import com.example.examSchedulerBackend.model.Session;
import com.example.examSchedulerBackend.model.TimeSlot;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Seats candidates into lab-days.
 *
 * <p>Dates are walked in order and, within a date, labs in order. Each lab takes
 * the next chunk of up to {@code studentsPerLab} candidates; the chunk is split
 * forenoon first, then afternoon. Lab-days that would receive nobody are not
 * emitted, so reading the result date, lab, forenoon, afternoon gives back the
 * input order.
 *
 * <p>Internal and external examiners are picked by the lab's position in the lab
 * list, modulo the pool size, so lab <i>k</i> gets the same examiners on every
 * date.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AllocationService {

    private final CapacityProfile capacityProfile;

    public List<LabSchedule> allocate(AllocationInput input) {
        return allocate(input, capacityProfile);
    }

    public List<LabSchedule> allocate(AllocationInput input, CapacityProfile profile) {
        List<String> dates = orEmpty(input.getDates());
        List<String> labs = orEmpty(input.getLabs());
        Map<String, String> subjects = input.getDateSubjects() == null ? Map.of() : input.getDateSubjects();
        Map<String, CohortKey> cohorts = buildCohortLookup(orEmpty(input.getSemesters()));
        ExaminerPools pools = new ExaminerPools(orEmpty(input.getInternalExaminers()),
                orEmpty(input.getExternalExaminers()));

        List<LabSchedule> schedules = new ArrayList<>();
        if (input.isDateKeyed()) {
            for (String date : dates) {
                List<String> pool = input.getDateRegisterNumbers().getOrDefault(date, Collections.emptyList());
                int placed = fillDate(date, subjects.get(date), pool, 0, labs, pools, cohorts, profile, schedules);
                if (placed < pool.size()) {
                    log.warn("Date {} has {} candidates but only {} seats across {} labs",
                            date, pool.size(), placed, labs.size());
                }
            }
        } else {
            List<String> pool = orEmpty(input.getRegisterNumbers());
            int next = 0;
            for (String date : dates) {
                if (next >= pool.size()) {
                    break;
                }
                next += fillDate(date, subjects.get(date), pool, next, labs, pools, cohorts, profile, schedules);
            }
            if (next < pool.size()) {
                log.warn("{} of {} candidates left unplaced after {} dates", pool.size() - next, pool.size(), dates.size());
            }
        }
        log.debug("Allocated {} lab schedules", schedules.size());
        return schedules;
    }

    /**
     * Seats candidates from {@code pool} starting at {@code start} into the labs
     * of one date and returns how many were placed.
     */
    private int fillDate(String date, String subject, List<String> pool, int start, List<String> labs,
                         ExaminerPools pools, Map<String, CohortKey> cohorts, CapacityProfile profile,
                         List<LabSchedule> out) {
        int index = start;
        for (int labIndex = 0; labIndex < labs.size(); labIndex++) {
            if (index >= pool.size()) {
                break;
            }
            int end = Math.min(index + profile.getStudentsPerLab(), pool.size());
            List<String> chunk = new ArrayList<>(pool.subList(index, end));

            LabSchedule schedule = new LabSchedule();
            schedule.setDate(date);
            schedule.setSubject(subject);
            schedule.setLab(labs.get(labIndex));
            schedule.setSlots(splitIntoSlots(chunk, profile));
            schedule.setInternalExaminer(pools.internalFor(labIndex));
            schedule.setExternalExaminer(pools.externalFor(labIndex));
            applyCohort(schedule, chunk, cohorts);

            out.add(schedule);
            index = end;
        }
        return index - start;
    }

    /**
     * Forenoon takes the first {@code forenoonCapacity} candidates, afternoon the
     * rest up to {@code afternoonCapacity}. Both slots are always returned.
     */
    public List<TimeSlot> splitIntoSlots(List<String> chunk, CapacityProfile profile) {
        int forenoonEnd = Math.min(profile.getForenoonCapacity(), chunk.size());
        int afternoonEnd = Math.min(profile.getForenoonCapacity() + profile.getAfternoonCapacity(), chunk.size());

        List<TimeSlot> slots = new ArrayList<>(2);
        slots.add(createSlot(Session.FORENOON, profile.getForenoonTime(), chunk.subList(0, forenoonEnd)));
        slots.add(createSlot(Session.AFTERNOON, profile.getAfternoonTime(), chunk.subList(forenoonEnd, afternoonEnd)));
        return slots;
    }

    private TimeSlot createSlot(Session session, String time, List<String> registerNumbers) {
        return new TimeSlot(time, session, registerNumbers.size(), new ArrayList<>(registerNumbers));
    }

    /**
     * Majority vote over the chunk's (semester, batch label) pairs. The most
     * frequent pair sets the semester; ties go to the pair met first. When more
     * than one pair is present the batch becomes every label seen, sorted and
     * comma-joined.
     */
    void applyCohort(LabSchedule schedule, List<String> chunk, Map<String, CohortKey> cohorts) {
        if (cohorts.isEmpty()) {
            return;
        }
        Map<CohortKey, Integer> counts = new LinkedHashMap<>();
        for (String registerNumber : chunk) {
            CohortKey key = cohorts.get(registerNumber);
            if (key != null) {
                counts.merge(key, 1, Integer::sum);
            }
        }
        if (counts.isEmpty()) {
            return;
        }

        CohortKey best = null;
        int bestCount = 0;
        for (Map.Entry<CohortKey, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        schedule.setSemester(best.getSemester());
        schedule.setBatch(best.getBatchLabel());

        if (counts.size() > 1) {
            TreeSet<String> labels = new TreeSet<>();
            for (CohortKey key : counts.keySet()) {
                labels.add(key.getBatchLabel());
            }
            schedule.setBatch(String.join(", ", labels));
        }
    }

    Map<String, CohortKey> buildCohortLookup(List<Semester> semesters) {
        Map<String, CohortKey> lookup = new HashMap<>();
        for (Semester semester : semesters) {
            if (semester == null) {
                continue;
            }
            String semesterName = semester.getName() == null ? "" : semester.getName();
            for (Batch batch : orEmpty(semester.getBatches())) {
                if (batch == null) {
                    continue;
                }
                String batchName = batch.getName() == null ? "" : batch.getName();
                CohortKey key = new CohortKey(semesterName, semesterName + batchName);
                for (String registerNumber : orEmpty(batch.getRegisterNumbers())) {
                    lookup.put(registerNumber, key);
                }
            }
        }
        return lookup;
    }

    public List<String> flattenRegisterNumbers(List<LabSchedule> schedules) {
        List<String> all = new ArrayList<>();
        for (LabSchedule schedule : schedules) {
            for (TimeSlot slot : schedule.getSlots()) {
                all.addAll(slot.getRegisterNumbers());
            }
        }
        return all;
    }

    public Map<String, Integer> countStudentsPerDate(List<LabSchedule> schedules) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (LabSchedule schedule : schedules) {
            counts.merge(schedule.getDate(), schedule.getStudentCount(), Integer::sum);
        }
        return counts;
    }

    public List<Integer> countStudentsPerLab(List<LabSchedule> schedules) {
        List<Integer> counts = new ArrayList<>(schedules.size());
        for (LabSchedule schedule : schedules) {
            counts.add(schedule.getStudentCount());
        }
        return counts;
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? Collections.emptyList() : list;
    }

    @Value
    static class CohortKey {
        String semester;
        String batchLabel;
    }

    @Value
    private static class ExaminerPools {
        List<Examiner> internal;
        List<Examiner> external;

        Examiner internalFor(int labIndex) {
            return internal.isEmpty() ? null : internal.get(labIndex % internal.size());
        }

        Examiner externalFor(int labIndex) {
            return external.isEmpty() ? null : external.get(labIndex % external.size());
        }
    }
}
