package com.example.examSchedulerBackend.service;

import com.example.examSchedulerBackend.model.AllocationInput;
import com.example.examSchedulerBackend.model.Batch;
import com.example.examSchedulerBackend.model.CapacityProfile;
import com.example.examSchedulerBackend.model.Examiner;
import com.example.examSchedulerBackend.model.LabSchedule;
import com.example.examSchedulerBackend.model.Semester;
import com.example.examSchedulerBackend.model.Session;
import com.example.examSchedulerBackend.model.TimeSlot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AllocationServiceTest {

    private static final List<String> LABS = List.of("Lab 1", "Lab 2", "Lab 3", "Lab 4", "Lab 5");

    private final AllocationService service = new AllocationService(CapacityProfile.STANDARD);

    private static List<String> registerNumbers(int count) {
        List<String> numbers = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            numbers.add(String.format("REG%04d", i));
        }
        return numbers;
    }

    private static List<String> dates(int count) {
        List<String> dates = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            dates.add(String.format("%02d-01-25", (i % 28) + 1));
        }
        return dates;
    }

    private List<LabSchedule> allocate(int students, int dateCount) {
        return service.allocate(AllocationInput.builder()
                .registerNumbers(registerNumbers(students))
                .dates(dates(dateCount))
                .labs(LABS)
                .build());
    }

    @Test
    void allocate_fullLab_splitsThirteenAndTwelve() {
        List<LabSchedule> schedules = allocate(25, 1);

        assertThat(schedules).hasSize(1);
        LabSchedule schedule = schedules.get(0);
        assertThat(schedule.getLab()).isEqualTo("Lab 1");
        assertThat(schedule.getSlots()).hasSize(2);
        assertThat(schedule.getSlots().get(0).getSession()).isEqualTo(Session.FORENOON);
        assertThat(schedule.getSlots().get(0).getRegisterNumbers()).hasSize(13);
        assertThat(schedule.getSlots().get(0).getCapacity()).isEqualTo(13);
        assertThat(schedule.getSlots().get(0).getTime()).isEqualTo("09:30 am - 12:30 pm");
        assertThat(schedule.getSlots().get(1).getSession()).isEqualTo(Session.AFTERNOON);
        assertThat(schedule.getSlots().get(1).getRegisterNumbers()).hasSize(12);
        assertThat(schedule.getSlots().get(1).getTime()).isEqualTo("01:30 pm - 04:30 pm");
    }

    @Test
    void allocate_overflowsToSecondDate_withPartialLab() {
        List<LabSchedule> schedules = service.allocate(AllocationInput.builder()
                .registerNumbers(registerNumbers(130))
                .dates(List.of("01-01-25", "02-01-25"))
                .labs(LABS)
                .build());

        assertThat(schedules).hasSize(6);
        assertThat(service.countStudentsPerDate(schedules)).containsEntry("01-01-25", 125).containsEntry("02-01-25", 5);
        LabSchedule last = schedules.get(5);
        assertThat(last.getDate()).isEqualTo("02-01-25");
        assertThat(last.getLab()).isEqualTo("Lab 1");
        assertThat(last.getSlots().get(0).getRegisterNumbers()).hasSize(5);
        assertThat(last.getSlots().get(1).getRegisterNumbers()).isEmpty();
        assertThat(last.getSlots().get(1).getCapacity()).isZero();
    }

    @Test
    void allocate_keepsEveryInvariant_forManyRosterSizes() {
        for (int students = 1; students <= 520; students++) {
            int dateCount = students / 125 + 2;
            List<String> input = registerNumbers(students);
            List<LabSchedule> schedules = service.allocate(AllocationInput.builder()
                    .registerNumbers(input)
                    .dates(dates(dateCount))
                    .labs(LABS)
                    .build());

            assertThat(service.flattenRegisterNumbers(schedules)).isEqualTo(input);
            for (LabSchedule schedule : schedules) {
                List<TimeSlot> slots = schedule.getSlots();
                assertThat(slots).hasSize(2);
                int forenoon = slots.get(0).getRegisterNumbers().size();
                int afternoon = slots.get(1).getRegisterNumbers().size();
                assertThat(forenoon + afternoon).isBetween(1, 25);
                assertThat(forenoon).isLessThanOrEqualTo(13);
                assertThat(afternoon).isLessThanOrEqualTo(12);
                if (afternoon > 0) {
                    assertThat(forenoon).isEqualTo(13);
                }
            }
            assertThat(service.countStudentsPerDate(schedules).values()).allMatch(count -> count <= 125);
        }
    }

    @Test
    void allocate_stopsAtCapacity_whenDatesRunOut() {
        List<LabSchedule> schedules = allocate(300, 2);

        assertThat(schedules).hasSize(10);
        assertThat(service.flattenRegisterNumbers(schedules)).isEqualTo(registerNumbers(250));
    }

    @Test
    void allocate_returnsEmpty_forNoDatesOrNoLabs() {
        assertThat(allocate(40, 0)).isEmpty();
        assertThat(service.allocate(AllocationInput.builder()
                .registerNumbers(registerNumbers(40))
                .dates(dates(1))
                .build())).isEmpty();
        assertThat(allocate(0, 3)).isEmpty();
    }

    @Test
    void allocate_cyclesExaminersByLabPosition() {
        List<Examiner> internal = List.of(new Examiner("I1", "Asha"), new Examiner("I2", "Binu"));
        List<Examiner> external = List.of(new Examiner("E1", "Cyril"), new Examiner("E2", "Devi"), new Examiner("E3", "Eby"));

        List<LabSchedule> schedules = service.allocate(AllocationInput.builder()
                .registerNumbers(registerNumbers(250))
                .dates(List.of("01-01-25", "02-01-25"))
                .labs(LABS)
                .internalExaminers(internal)
                .externalExaminers(external)
                .build());

        assertThat(schedules).extracting(s -> s.getInternalExaminer().getId())
                .containsExactly("I1", "I2", "I1", "I2", "I1", "I1", "I2", "I1", "I2", "I1");
        assertThat(schedules).extracting(s -> s.getExternalExaminer().getId())
                .containsExactly("E1", "E2", "E3", "E1", "E2", "E1", "E2", "E3", "E1", "E2");
    }

    @Test
    void allocate_leavesExaminersUnset_whenPoolsEmpty() {
        List<LabSchedule> schedules = allocate(30, 1);

        assertThat(schedules).allSatisfy(s -> {
            assertThat(s.getInternalExaminer()).isNull();
            assertThat(s.getExternalExaminer()).isNull();
        });
    }

    @Test
    void allocate_attachesSubjectPerDate() {
        List<LabSchedule> schedules = service.allocate(AllocationInput.builder()
                .registerNumbers(registerNumbers(130))
                .dates(List.of("01-01-25", "02-01-25"))
                .labs(LABS)
                .dateSubjects(Map.of("02-01-25", "Compiler Lab"))
                .build());

        assertThat(schedules.get(0).getSubject()).isNull();
        assertThat(schedules.get(5).getSubject()).isEqualTo("Compiler Lab");
    }

    @Test
    void allocate_dateKeyedMode_fillsEachDateFromItsOwnList() {
        List<LabSchedule> schedules = service.allocate(AllocationInput.builder()
                .dates(List.of("01-01-25", "02-01-25", "03-01-25"))
                .labs(LABS)
                .dateRegisterNumbers(Map.of(
                        "01-01-25", List.of("A1", "A2", "A3"),
                        "03-01-25", registerNumbers(30)))
                .build());

        assertThat(schedules).hasSize(3);
        assertThat(schedules.get(0).getDate()).isEqualTo("01-01-25");
        assertThat(schedules.get(0).getLab()).isEqualTo("Lab 1");
        assertThat(schedules.get(0).getSlots().get(0).getRegisterNumbers()).containsExactly("A1", "A2", "A3");
        assertThat(schedules.get(1).getDate()).isEqualTo("03-01-25");
        assertThat(schedules.get(1).getLab()).isEqualTo("Lab 1");
        assertThat(schedules.get(1).getStudentCount()).isEqualTo(25);
        assertThat(schedules.get(2).getLab()).isEqualTo("Lab 2");
        assertThat(schedules.get(2).getStudentCount()).isEqualTo(5);
    }

    @Test
    void allocate_dateKeyedMode_dropsOverflowBeyondLabs() {
        List<LabSchedule> schedules = service.allocate(AllocationInput.builder()
                .dates(List.of("01-01-25"))
                .labs(List.of("Lab 1", "Lab 2"))
                .dateRegisterNumbers(Map.of("01-01-25", registerNumbers(60)))
                .build());

        assertThat(service.countStudentsPerLab(schedules)).containsExactly(25, 25);
    }

    @Test
    void allocate_labelsCohort_whenChunkHasSingleBatch() {
        Semester s3 = new Semester("S3", List.of(new Batch("A", registerNumbers(25))));

        List<LabSchedule> schedules = service.allocate(AllocationInput.builder()
                .registerNumbers(registerNumbers(25))
                .dates(dates(1))
                .labs(LABS)
                .semesters(List.of(s3))
                .build());

        assertThat(schedules.get(0).getSemester()).isEqualTo("S3");
        assertThat(schedules.get(0).getBatch()).isEqualTo("S3A");
    }

    @Test
    void allocate_listsAllBatches_whenChunkMixesCohorts() {
        List<String> roster = registerNumbers(25);
        Semester s5 = new Semester("S5", List.of(
                new Batch("B", roster.subList(0, 5)),
                new Batch("A", roster.subList(5, 20))));
        Semester s1 = new Semester("S1", List.of(new Batch("C", roster.subList(20, 23))));

        List<LabSchedule> schedules = service.allocate(AllocationInput.builder()
                .registerNumbers(roster)
                .dates(dates(1))
                .labs(LABS)
                .semesters(List.of(s5, s1))
                .build());

        // S5A is the majority, REG0023 and REG0024 belong to no cohort
        assertThat(schedules.get(0).getSemester()).isEqualTo("S5");
        assertThat(schedules.get(0).getBatch()).isEqualTo("S1C, S5A, S5B");
    }

    @Test
    void allocate_breaksCohortTiesByFirstSeen() {
        List<String> roster = List.of("X1", "Y1", "X2", "Y2");
        List<Semester> semesters = List.of(
                new Semester("S2", List.of(new Batch("A", List.of("Y1", "Y2")))),
                new Semester("S7", List.of(new Batch("B", List.of("X1", "X2")))));

        List<LabSchedule> schedules = service.allocate(AllocationInput.builder()
                .registerNumbers(roster)
                .dates(dates(1))
                .labs(LABS)
                .semesters(semesters)
                .build());

        assertThat(schedules.get(0).getSemester()).isEqualTo("S7");
        assertThat(schedules.get(0).getBatch()).isEqualTo("S2A, S7B");
    }

    @Test
    void allocate_leavesCohortUnset_whenNoCandidateIsKnown() {
        Semester s1 = new Semester("S1", List.of(new Batch("A", List.of("OTHER1"))));

        List<LabSchedule> schedules = service.allocate(AllocationInput.builder()
                .registerNumbers(registerNumbers(10))
                .dates(dates(1))
                .labs(LABS)
                .semesters(List.of(s1))
                .build());

        assertThat(schedules.get(0).getSemester()).isNull();
        assertThat(schedules.get(0).getBatch()).isNull();
    }

    @Test
    void allocate_followsAlternateCapacityProfile() {
        CapacityProfile profile = CapacityProfile.builder()
                .studentsPerLab(10).forenoonCapacity(6).afternoonCapacity(4).labsPerDay(2).build();

        List<LabSchedule> schedules = service.allocate(AllocationInput.builder()
                .registerNumbers(registerNumbers(15))
                .dates(dates(1))
                .labs(List.of("L1", "L2"))
                .build(), profile);

        assertThat(schedules).hasSize(2);
        assertThat(schedules.get(0).getSlots().get(0).getRegisterNumbers()).hasSize(6);
        assertThat(schedules.get(0).getSlots().get(1).getRegisterNumbers()).hasSize(4);
        assertThat(schedules.get(1).getSlots().get(0).getRegisterNumbers()).hasSize(5);
        assertThat(schedules.get(1).getSlots().get(1).getRegisterNumbers()).isEmpty();
    }

    @Test
    void countStudentsPerLab_matchesSlotTotals() {
        assertThat(service.countStudentsPerLab(allocate(60, 1))).containsExactly(25, 25, 10);
    }
}
