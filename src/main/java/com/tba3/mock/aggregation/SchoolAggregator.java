package com.tba3.mock.aggregation;

import com.tba3.mock.aggregation.AggregationModels.*;
import com.tba3.mock.booklet.BookletKey;
import com.tba3.mock.booklet.BookletModels.Booklet;
import com.tba3.mock.booklet.BookletModels.DomainKey;
import com.tba3.mock.booklet.BookletModels.Item;
import com.tba3.mock.generator.GeneratorModels.GroupData;
import com.tba3.mock.generator.ResponseMatrix;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class SchoolAggregator {
    private final AggregationEngine engine;

    public SchoolAggregator(AggregationEngine engine) {
        this.engine = engine;
    }

    public List<CompetenceLevelGroup> competenceLevels(String schoolId, String schoolName, List<ScopedGroup> groups) {
        Map<DomainKey, List<CompetenceLevelGroup>> byKey = new LinkedHashMap<>();
        for (ScopedGroup group : groups) {
            String subject = group.data().booklet().subject();
            List<CompetenceLevelGroup> perGroup = engine.competenceLevels(group.data(), group.tables());
            for (int i = 0; i < perGroup.size(); i++) {
                DomainKey key = new DomainKey(subject, group.tables().get(i).domain());
                byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(perGroup.get(i));
            }
        }

        List<CompetenceLevelGroup> result = new ArrayList<>();
        byKey.forEach((key, entries) -> {
            Map<String, Integer> frequencies = new HashMap<>();
            Map<String, CompetenceLevelFrequency> firstSeen = new LinkedHashMap<>();
            for (CompetenceLevelGroup entry : entries) {
                for (CompetenceLevelFrequency level : entry.competenceLevels()) {
                    frequencies.merge(level.nameShort(), level.frequency(), Integer::sum);
                    firstSeen.putIfAbsent(level.nameShort(), level);
                }
            }
            List<CompetenceLevelFrequency> levels = entries.get(0).competenceLevels().stream()
                    .map(level -> {
                        CompetenceLevelFrequency meta = firstSeen.get(level.nameShort());
                        return new CompetenceLevelFrequency(level.nameShort(), meta.name(), meta.description(),
                                frequencies.getOrDefault(level.nameShort(), 0));
                    })
                    .toList();
            result.add(new CompetenceLevelGroup(schoolId, schoolName, entries.get(0).domain(), levels, null));
        });
        return result;
    }

    public List<ItemGroup> itemStatistics(String schoolId, String schoolName, List<GroupData> groups) {
        Map<BookletKey, List<GroupData>> byBooklet = new LinkedHashMap<>();
        for (GroupData group : groups) {
            byBooklet.computeIfAbsent(group.booklet().key(), k -> new ArrayList<>()).add(group);
        }
        List<ItemGroup> result = new ArrayList<>();
        byBooklet.values().forEach(bookletGroups -> {
            Booklet booklet = bookletGroups.get(0).booklet();
            ResponseMatrix pooled = ResponseMatrix.concat(bookletGroups.stream().map(GroupData::responses).toList());
            result.addAll(engine.itemStatistics(schoolId, schoolName, booklet, pooled));
        });
        return result;
    }

    public List<AggregationGroup> domainAggregations(String schoolId, String schoolName, List<GroupData> groups) {
        Map<DomainKey, List<Double>> studentMeans = new LinkedHashMap<>();
        Map<DomainKey, Long> frequencies = new HashMap<>();
        Map<DomainKey, Set<String>> itemIds = new HashMap<>();

        for (GroupData group : groups) {
            String subject = group.booklet().subject();
            group.booklet().itemsByDomain().forEach((domain, items) -> {
                DomainKey key = new DomainKey(subject, domain);
                List<Double> means = studentMeans.computeIfAbsent(key, k -> new ArrayList<>());
                for (double mean : group.responses().rowMeans(items)) {
                    means.add(mean);
                }
                long correct = Arrays.stream(group.responses().rawScores(items)).asLongStream().sum();
                frequencies.merge(key, correct, Long::sum);
                itemIds.computeIfAbsent(key, k -> new TreeSet<>())
                        .addAll(items.stream().map(Item::iqbItemId).toList());
            });
        }

        List<AggregationGroup> result = new ArrayList<>();
        studentMeans.forEach((key, means) -> {
            double[] values = means.stream().mapToDouble(Double::doubleValue).toArray();
            Set<String> ids = itemIds.get(key);
            DescriptiveStatistics stats = new DescriptiveStatistics(ids.size(), Stats.mean(values),
                    frequencies.get(key), Stats.standardDeviation(values));
            Aggregation aggregation = new Aggregation(Stats.AGGREGATION_TYPE,
                    key.domain() != null ? key.domain() : key.subject(), stats, List.copyOf(ids));
            result.add(new AggregationGroup(schoolId, schoolName, Stats.domain(key.domain(), key.subject()),
                    List.of(aggregation), null));
        });
        return result;
    }
}
