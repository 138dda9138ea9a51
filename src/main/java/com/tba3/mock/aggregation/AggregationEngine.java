package com.tba3.mock.aggregation;

import com.tba3.mock.aggregation.AggregationModels.*;
import com.tba3.mock.booklet.BookletModels.Booklet;
import com.tba3.mock.booklet.BookletModels.Item;
import com.tba3.mock.config.ConfigModels.CompetenceLevelRange;
import com.tba3.mock.config.ConfigModels.EquivalenceTableEntry;
import com.tba3.mock.equivalence.EquivalenceMatcher;
import com.tba3.mock.generator.GeneratorModels.GroupData;
import com.tba3.mock.generator.GeneratorModels.Student;
import com.tba3.mock.generator.ResponseMatrix;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class AggregationEngine {
    private final EquivalenceMatcher matcher;

    public AggregationEngine(EquivalenceMatcher matcher) {
        this.matcher = matcher;
    }

    public List<ItemGroup> itemStatistics(GroupData group) {
        return itemStatistics(group.groupId(), group.profile().name(), group.booklet(), group.responses());
    }

    public List<ItemGroup> itemStatistics(String id, String name, Booklet booklet, ResponseMatrix responses) {
        List<ItemGroup> result = new ArrayList<>();
        booklet.itemsByDomain().forEach((domain, items) -> {
            List<ItemStatistics> stats = sortedByOrder(items).stream()
                    .map(item -> new ItemStatistics(item.itemNrBooklet(), item.iqbItemId(), Stats.parameters(item),
                            Stats.ofColumn(responses.column(item))))
                    .toList();
            result.add(new ItemGroup(id, name, Stats.domain(domain, booklet.subject()), stats, null));
        });
        return result;
    }

    public List<AggregationGroup> domainAggregations(GroupData group) {
        return domainAggregations(group.groupId(), group.profile().name(), group);
    }

    public List<AggregationGroup> domainAggregations(String id, String name, GroupData group) {
        Booklet booklet = group.booklet();
        List<AggregationGroup> result = new ArrayList<>();
        booklet.itemsByDomain().forEach((domain, items) -> {
            double[] studentMeans = group.responses().rowMeans(items);
            long frequency = Arrays.stream(group.responses().rawScores(items)).asLongStream().sum();
            DescriptiveStatistics stats = new DescriptiveStatistics(items.size(),
                    Stats.mean(studentMeans), frequency, Stats.standardDeviation(studentMeans));
            Aggregation aggregation = new Aggregation(Stats.AGGREGATION_TYPE, domain != null ? domain : booklet.subject(),
                    stats, items.stream().map(Item::iqbItemId).toList());
            result.add(new AggregationGroup(id, name, Stats.domain(domain, booklet.subject()), List.of(aggregation), null));
        });
        return result;
    }

    public List<CompetenceLevelGroup> competenceLevels(GroupData group, List<EquivalenceTableEntry> tables) {
        return competenceLevels(group.groupId(), group.profile().name(), group, tables);
    }

    public List<CompetenceLevelGroup> competenceLevels(String id, String name, GroupData group,
                                                       List<EquivalenceTableEntry> tables) {
        List<CompetenceLevelGroup> result = new ArrayList<>();
        for (EquivalenceTableEntry entry : tables) {
            Map<String, Integer> counts = new HashMap<>();
            for (int score : matcher.rawScores(group, entry)) {
                counts.merge(matcher.classify(score, entry), 1, Integer::sum);
            }
            List<CompetenceLevelFrequency> levels = entry.competenceLevels().stream()
                    .map(cl -> new CompetenceLevelFrequency(cl.nameShort(), cl.name(), cl.description(),
                            counts.getOrDefault(cl.nameShort(), 0)))
                    .toList();
            result.add(new CompetenceLevelGroup(id, name, Stats.domain(entry.domain(), group.booklet().subject()),
                    levels, null));
        }
        return result;
    }

    public List<CompetenceLevelGroup> studentCompetenceLevels(GroupData group, List<EquivalenceTableEntry> tables) {
        List<Student> students = group.students().students();
        List<CompetenceLevelGroup> result = new ArrayList<>();
        for (EquivalenceTableEntry entry : tables) {
            int[] scores = matcher.rawScores(group, entry);
            Domain domain = Stats.domain(entry.domain(), group.booklet().subject());
            for (int s = 0; s < students.size(); s++) {
                String matched = matcher.classify(scores[s], entry);
                List<CompetenceLevelFrequency> levels = new ArrayList<>();
                for (CompetenceLevelRange cl : entry.competenceLevels()) {
                    levels.add(new CompetenceLevelFrequency(cl.nameShort(), cl.name(), cl.description(),
                            cl.nameShort().equals(matched) ? 1 : 0));
                }
                Student student = students.get(s);
                result.add(new CompetenceLevelGroup(student.id(), student.name(), domain, levels, covariates(student)));
            }
        }
        return result;
    }

    public List<ItemGroup> studentItemStatistics(GroupData group) {
        Booklet booklet = group.booklet();
        List<Student> students = group.students().students();
        List<ItemGroup> result = new ArrayList<>();
        booklet.itemsByDomain().forEach((domainName, items) -> {
            List<Item> sorted = sortedByOrder(items);
            List<ItemParameters> parameters = sorted.stream().map(Stats::parameters).toList();
            Domain domain = Stats.domain(domainName, booklet.subject());
            for (int s = 0; s < students.size(); s++) {
                List<ItemStatistics> stats = new ArrayList<>(sorted.size());
                for (int i = 0; i < sorted.size(); i++) {
                    Item item = sorted.get(i);
                    int score = group.responses().score(s, item);
                    stats.add(new ItemStatistics(item.itemNrBooklet(), item.iqbItemId(), parameters.get(i),
                            new DescriptiveStatistics(1, score, score, 0.0)));
                }
                Student student = students.get(s);
                result.add(new ItemGroup(student.id(), student.name(), domain, stats, covariates(student)));
            }
        });
        return result;
    }

    public List<AggregationGroup> studentAggregations(GroupData group) {
        Booklet booklet = group.booklet();
        List<Student> students = group.students().students();
        List<AggregationGroup> result = new ArrayList<>();
        booklet.itemsByDomain().forEach((domainName, items) -> {
            int[] scores = group.responses().rawScores(items);
            List<String> ids = items.stream().map(Item::iqbItemId).toList();
            Domain domain = Stats.domain(domainName, booklet.subject());
            String value = domainName != null ? domainName : booklet.subject();
            for (int s = 0; s < students.size(); s++) {
                DescriptiveStatistics stats = new DescriptiveStatistics(items.size(),
                        Stats.round((double) scores[s] / items.size()), scores[s], 0.0);
                Student student = students.get(s);
                result.add(new AggregationGroup(student.id(), student.name(), domain,
                        List.of(new Aggregation(Stats.AGGREGATION_TYPE, value, stats, ids)), covariates(student)));
            }
        });
        return result;
    }

    private static List<Item> sortedByOrder(List<Item> items) {
        return items.stream().sorted(Comparator.comparingDouble(Item::itemOrderBooklet)).toList();
    }

    private static List<Covariate> covariates(Student student) {
        return student.covariates().entrySet().stream()
                .map(e -> new Covariate(e.getKey(), e.getValue()))
                .toList();
    }
}
