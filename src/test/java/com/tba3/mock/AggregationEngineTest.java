package com.tba3.mock;

import com.tba3.mock.aggregation.AggregationEngine;
import com.tba3.mock.aggregation.AggregationModels.*;
import com.tba3.mock.booklet.BookletModels.Booklet;
import com.tba3.mock.config.ConfigModels.EquivalenceTableEntry;
import com.tba3.mock.equivalence.EquivalenceMatcher;
import com.tba3.mock.generator.GeneratorModels.GroupData;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tba3.mock.TestBooklets.*;
import static org.junit.jupiter.api.Assertions.*;

class AggregationEngineTest {
    private final AggregationEngine engine = new AggregationEngine(new EquivalenceMatcher());

    private final Booklet booklet = booklet("V3-2024-DE-TH1",
            item("D2", "LE", 2, 0), item("D1", "LE", 1, 0), item("H1", "ZU", 3, 0));
    private final GroupData group = group("3a", booklet, new int[][]{
            {1, 0, 1},
            {1, 1, 0},
            {0, 0, 0},
            {1, 1, 1}});
    private final List<EquivalenceTableEntry> tables = List.of(
            table("V3-2024-DE-TH1", "LE", level("I", 0, 0), level("II", 1, 2)),
            table("V3-2024-DE-TH1", "ZU", level("I", 0, 0), level("II", 1, 1)));

    @Test
    void itemStatisticsPerDomainInItemOrder() {
        List<ItemGroup> records = engine.itemStatistics(group);

        assertEquals(2, records.size());
        ItemGroup reading = records.get(0);
        assertEquals("3a", reading.id());
        assertEquals("Klasse 3a", reading.name());
        assertEquals(new Domain("LE", new Subject("Deutsch")), reading.domain());
        assertNull(reading.covariates());
        assertEquals(List.of("D1", "D2"), reading.items().stream().map(ItemStatistics::iqbId).toList());

        DescriptiveStatistics d1 = reading.items().get(0).descriptiveStatistics();
        assertEquals(new DescriptiveStatistics(4, 0.75, 3, 0.5), d1);
        DescriptiveStatistics d2 = reading.items().get(1).descriptiveStatistics();
        assertEquals(0.5, d2.mean());
        assertEquals(0.5774, d2.standardDeviation());
    }

    @Test
    void domainAggregationUsesPerStudentMeans() {
        List<AggregationGroup> records = engine.domainAggregations(group);

        Aggregation reading = records.get(0).aggregations().get(0);
        assertEquals("custom", reading.type());
        assertEquals("LE", reading.value());
        assertEquals(List.of("D2", "D1"), reading.includedIqbIds());
        assertEquals(2, reading.descriptiveStatistics().total());
        assertEquals(5, reading.descriptiveStatistics().frequency());
        assertEquals(0.625, reading.descriptiveStatistics().mean());
        assertEquals(0.4787, reading.descriptiveStatistics().standardDeviation());
    }

    @Test
    void competenceLevelFrequenciesAddUpToGroupSize() {
        List<CompetenceLevelGroup> records = engine.competenceLevels(group, tables);

        assertEquals(2, records.size());
        assertEquals(List.of(1, 3), frequencies(records.get(0)));
        assertEquals(List.of(2, 2), frequencies(records.get(1)));
        records.forEach(r -> assertEquals(4, frequencies(r).stream().mapToInt(Integer::intValue).sum()));
    }

    @Test
    void levelsWithoutStudentsAreListedWithZero() {
        EquivalenceTableEntry wide = table("V3-2024-DE-TH1", null,
                level("I", 0, 0), level("II", 1, 1), level("III", 2, 2), level("IV", 3, 3));

        CompetenceLevelGroup record = engine.competenceLevels(group, List.of(wide)).get(0);

        assertEquals(List.of("I", "II", "III", "IV"), record.competenceLevels().stream().map(CompetenceLevelFrequency::nameShort).toList());
        assertEquals(List.of(1, 0, 2, 1), frequencies(record));
        assertEquals("Deutsch", record.domain().name());
    }

    @Test
    void studentRecordsCarryScoresAndCovariates() {
        List<CompetenceLevelGroup> levels = engine.studentCompetenceLevels(group, tables);
        assertEquals(8, levels.size());
        assertEquals("s2", levels.get(2).id());
        assertEquals(List.of(1, 0), frequencies(levels.get(2)));
        assertEquals(List.of(new Covariate("gender", "m")), levels.get(2).covariates());

        List<ItemGroup> items = engine.studentItemStatistics(group);
        ItemGroup first = items.get(0);
        assertEquals("s0", first.id());
        assertEquals(new DescriptiveStatistics(1, 1.0, 1, 0.0), first.items().get(0).descriptiveStatistics());
        assertEquals(new DescriptiveStatistics(1, 0.0, 0, 0.0), first.items().get(1).descriptiveStatistics());

        List<AggregationGroup> aggregations = engine.studentAggregations(group);
        DescriptiveStatistics s1 = aggregations.get(1).aggregations().get(0).descriptiveStatistics();
        assertEquals(new DescriptiveStatistics(2, 1.0, 2, 0.0), s1);
        assertEquals("w", aggregations.get(1).covariates().get(0).value());
    }

    private static List<Integer> frequencies(CompetenceLevelGroup record) {
        return record.competenceLevels().stream().map(CompetenceLevelFrequency::frequency).toList();
    }
}
