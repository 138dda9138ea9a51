package com.tba3.mock;

import com.tba3.mock.aggregation.AggregationModels.*;
import com.tba3.mock.booklet.BookletCatalog;
import com.tba3.mock.config.ConfigModels.*;
import com.tba3.mock.config.ConfigStore;
import com.tba3.mock.error.ConfigValidationException;
import com.tba3.mock.error.NotFoundException;
import com.tba3.mock.parser.ConfigYamlParser;
import com.tba3.mock.service.ReportService;
import com.tba3.mock.service.RequestedTypes;
import com.tba3.mock.validation.ConfigValidator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ReportServiceTest {
    @Autowired
    private ReportService reportService;

    @Autowired
    private ConfigYamlParser configYamlParser;

    @Autowired
    private BookletCatalog catalog;

    @Autowired
    private ConfigValidator validator;

    private final RequestedTypes groupOnly = RequestedTypes.parse(null);

    @Test
    void groupReportsAreRegeneratedIdentically() {
        assertEquals(reportService.groupItems("3a", groupOnly), reportService.groupItems("3a", groupOnly));
        assertEquals(reportService.groupCompetenceLevels("3a", RequestedTypes.parse("group,students")),
                reportService.groupCompetenceLevels("3a", RequestedTypes.parse("group,students")));
    }

    @Test
    void groupRecordsUseConfiguredNameOrFallback() {
        assertEquals("Klasse 3a", reportService.groupItems("3a", groupOnly).get(0).name());
        assertEquals("Klasse 3a", reportService.groupAggregations("3a", groupOnly).get(0).name());
        assertEquals("Lerngruppe 3b", reportService.groupItems("3b", groupOnly).get(0).name());
        assertEquals("Lerngruppe 3b", reportService.groupCompetenceLevels("3b", groupOnly).get(0).name());
    }

    @Test
    void injectedValidatorGuardsTheConfigStore() {
        assertEquals(4, configYamlParser.load(Path.of("src/test/resources/fixtures/config"), catalog).groups().size());

        GroupsFile invalid = new GroupsFile(null, List.of(new GroupConfig("x", null, "V3-2024-DE-TH-1", 0.0, 0.0, 5, "x", null)));
        ConfigValidationException ex = assertThrows(ConfigValidationException.class, () -> ConfigStore.of(
                invalid, SchoolsFile.empty(), StatesFile.empty(), EquivalenceTablesFile.empty(), catalog, validator));
        assertEquals("INVALID_FIELD", ex.issues().get(0).code());
    }

    @Test
    void groupCompetenceLevelsCoverEveryStudent() {
        List<CompetenceLevelGroup> records = reportService.groupCompetenceLevels("3a", groupOnly);

        assertEquals(2, records.size());
        assertEquals("Klasse 3a", records.get(0).name());
        records.forEach(r -> assertEquals(24, total(r)));
    }

    @Test
    void typeSelectorSwitchesBetweenGroupAndStudentRecords() {
        assertEquals(48, reportService.groupCompetenceLevels("3a", RequestedTypes.parse("students")).size());
        assertEquals(50, reportService.groupCompetenceLevels("3a", RequestedTypes.parse("group,students")).size());

        List<AggregationGroup> students = reportService.groupAggregations("3a", RequestedTypes.parse("students"));
        assertEquals(48, students.size());
        assertEquals(List.of("gender", "migration"), students.get(0).covariates().stream().map(Covariate::type).toList());
    }

    @Test
    void schoolRecordsComeFirstFollowedByMemberGroups() {
        List<CompetenceLevelGroup> levels = reportService.schoolCompetenceLevels("gs-nord");

        assertEquals(7, levels.size());
        assertEquals("gs-nord", levels.get(0).id());
        assertEquals("Grundschule Nord", levels.get(0).name());
        assertEquals(54, total(levels.get(0)));
        assertEquals(42, total(levels.get(1)));
        assertEquals(List.of("3a", "3a", "3b", "3b", "3c"),
                levels.subList(2, 7).stream().map(CompetenceLevelGroup::id).toList());

        assertEquals(8, reportService.schoolItems("gs-nord").size());
        assertEquals(7, reportService.schoolAggregations("gs-nord").size());
    }

    @Test
    void stateRecordsAreKeyedByBooklet() {
        List<CompetenceLevelGroup> levels = reportService.stateCompetenceLevels("be");

        assertEquals(List.of("V3-2024-DE-TH-1", "V3-2024-DE-TH-1", "V3-2024-DE-TH3"),
                levels.stream().map(CompetenceLevelGroup::id).toList());
        levels.forEach(r -> assertEquals(40, total(r)));
        assertEquals(3, reportService.stateItems("be").size());
        assertEquals("Mathematik", reportService.stateAggregations("hh").get(0).domain().subject().name());
    }

    @Test
    void missingTablesAndUnknownIdsAreNotFound() {
        assertThrows(NotFoundException.class, () -> reportService.groupCompetenceLevels("m1", groupOnly));
        assertThrows(NotFoundException.class, () -> reportService.schoolCompetenceLevels("gs-sued"));
        assertThrows(NotFoundException.class, () -> reportService.stateCompetenceLevels("hh"));
        assertThrows(NotFoundException.class, () -> reportService.groupItems("nope", groupOnly));
        assertThrows(NotFoundException.class, () -> reportService.schoolItems("nope"));
        assertThrows(NotFoundException.class, () -> reportService.stateItems("nope"));
    }

    private static int total(CompetenceLevelGroup record) {
        return record.competenceLevels().stream().mapToInt(CompetenceLevelFrequency::frequency).sum();
    }
}
