package com.tba3.mock;

import com.tba3.mock.booklet.BookletModels.Booklet;
import com.tba3.mock.error.ComputationPreconditionException;
import com.tba3.mock.generator.GeneratorModels.*;
import com.tba3.mock.generator.GroupGenerator;
import com.tba3.mock.generator.ResponseGenerator;
import com.tba3.mock.generator.ResponseMatrix;
import com.tba3.mock.generator.SeededStreams;
import com.tba3.mock.generator.StudentGenerator;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static com.tba3.mock.TestBooklets.*;
import static org.junit.jupiter.api.Assertions.*;

class GeneratorTest {
    private final StudentGenerator students = new StudentGenerator();
    private final ResponseGenerator responses = new ResponseGenerator();
    private final GroupGenerator groups = new GroupGenerator(students, responses);

    private final ClassProfile profile = new ClassProfile("Klasse", 0.0, 1.0);
    private final List<CovariateDistribution> covariates = List.of(
            new CovariateDistribution("gender", List.of("m", "w", "d"), List.of(0.45, 0.45, 0.1)),
            new CovariateDistribution("migration", List.of("ja", "nein"), List.of(0.3, 0.7)));
    private final Booklet booklet = booklet("V3-2024-DE-TH1",
            item("D2", "LE", 2, 0.5), item("D1", "LE", 1, -0.5), item("D3", "ZU", 3, 1.0));

    @Test
    void seedChecksumIsAdler32() {
        assertEquals(0x00420042L, SeededStreams.checksum("A"));
    }

    @Test
    void sameSeedYieldsIdenticalGroup() {
        GroupData first = groups.generate("3a", booklet, profile, 25, covariates, "3a-2024");
        GroupData second = groups.generate("3a", booklet, profile, 25, covariates, "3a-2024");

        assertEquals(first.students(), second.students());
        assertArrayEquals(first.responses().toArray(), second.responses().toArray());
    }

    @Test
    void differentSeedsYieldDifferentStudents() {
        StudentTable a = students.generate(10, profile, "a", covariates);
        StudentTable b = students.generate(10, profile, "b", covariates);

        assertNotEquals(a.ids(), b.ids());
    }

    @Test
    void seedAThreeStudentsTwoItemsIsReproducible() {
        Booklet two = booklet("V3-2024-DE-TH2", item("X1", "LE", 1, 0.0), item("X2", "LE", 2, 0.0));

        StudentTable table = students.generate(3, profile, "A", List.of());
        ResponseMatrix first = responses.generate(table, two, "A");
        ResponseMatrix again = responses.generate(students.generate(3, profile, "A", List.of()), two, "A");

        assertEquals(3, first.studentCount());
        assertEquals(2, first.itemCount());
        assertArrayEquals(first.toArray(), again.toArray());
        for (int[] row : first.toArray()) {
            for (int score : row) {
                assertTrue(score == 0 || score == 1);
            }
        }
    }

    @Test
    void studentsHaveUniqueIdsNamesAndConfiguredCovariates() {
        StudentTable table = students.generate(200, profile, "covariates", covariates);

        assertEquals(200, new HashSet<>(table.ids()).size());
        assertEquals(List.of("gender", "migration"), table.covariateTypes());
        for (Student student : table.students()) {
            assertTrue(student.name().matches("[a-z]+\\.[a-z]+\\.\\d{2}"), student.name());
            assertTrue(List.of("m", "w", "d").contains(student.covariates().get("gender")));
            assertTrue(List.of("ja", "nein").contains(student.covariates().get("migration")));
        }
    }

    @Test
    void zeroProbabilityCategoryIsNeverDrawn() {
        List<CovariateDistribution> fixed = List.of(
                new CovariateDistribution("gender", List.of("m", "w"), List.of(0.0, 1.0)));

        StudentTable table = students.generate(50, profile, "fixed", fixed);

        assertTrue(table.students().stream().allMatch(s -> s.covariates().equals(Map.of("gender", "w"))));
    }

    @Test
    void responseColumnsFollowItemOrder() {
        GroupData group = groups.generate("3a", booklet, profile, 5, List.of(), "order");

        assertEquals(List.of("D1", "D2", "D3"), group.responses().items().stream().map(i -> i.iqbItemId()).toList());
    }

    @Test
    void veryAbleStudentsSolveEasyItems() {
        ClassProfile strong = new ClassProfile("stark", 20.0, 0.1);
        Booklet easy = booklet("V3-2024-DE-TH2", item("E1", null, 1, -20.0), item("E2", null, 2, -20.0));

        GroupData group = groups.generate("stark", easy, strong, 50, List.of(), "strong");

        int[] raw = group.responses().rawScores(easy.items());
        assertTrue(Arrays.stream(raw).allMatch(score -> score == 2));
    }

    @Test
    void missingSeedFallsBackToGroupId() {
        GroupData implicit = groups.generate("3a", booklet, profile, 5, List.of(), null);
        GroupData explicit = groups.generate("other", booklet, profile, 5, List.of(), "3a");

        assertEquals(implicit.students(), explicit.students());
    }

    @Test
    void invalidInputIsRejected() {
        assertThrows(ComputationPreconditionException.class, () -> students.generate(0, profile, "s", List.of()));
        assertThrows(ComputationPreconditionException.class,
                () -> responses.generate(students.generate(2, profile, "s", List.of()),
                        booklet("V3-2024-DE-TH1", item("D1", null, 1, 0), item("D1", null, 2, 0)), "s"));
        assertThrows(IllegalArgumentException.class, () -> new ClassProfile("x", 0.0, 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> new CovariateDistribution("gender", List.of("m", "w"), List.of(0.5, 0.4)));
    }
}
