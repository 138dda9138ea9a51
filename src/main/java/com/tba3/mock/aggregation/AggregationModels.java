package com.tba3.mock.aggregation;

import com.tba3.mock.config.ConfigModels.EquivalenceTableEntry;
import com.tba3.mock.generator.GeneratorModels.GroupData;

import java.util.List;

public class AggregationModels {
    public record Subject(String name) {}

    public record Domain(String name, Subject subject) {}

    public record DescriptiveStatistics(int total, double mean, long frequency, double standardDeviation) {}

    public record CompetenceLevelRef(String nameShort) {}

    public record ItemParameters(double logit,
                                 double bistaPoints,
                                 Double solutionFrequencyPrimarySchool,
                                 Double solutionFrequencyGymnasium,
                                 Double solutionFrequencyNonGymnasium,
                                 String subject,
                                 String domain,
                                 CompetenceLevelRef competenceLevel,
                                 List<String> competenceStandard,
                                 String listeningOrReadingStyle,
                                 List<String> generalMathematicalCompetence,
                                 List<String> coreIdea,
                                 String cognitiveDemandLevel) {}

    public record ItemStatistics(String name, String iqbId, ItemParameters parameters,
                                 DescriptiveStatistics descriptiveStatistics) {}

    public record CompetenceLevelFrequency(String nameShort, String name, String description, int frequency) {}

    public record Aggregation(String type, String value, DescriptiveStatistics descriptiveStatistics,
                              List<String> includedIqbIds) {}

    public record Covariate(String type, String value) {}

    public record CompetenceLevelGroup(String id, String name, Domain domain,
                                       List<CompetenceLevelFrequency> competenceLevels,
                                       List<Covariate> covariates) {}

    public record ItemGroup(String id, String name, Domain domain,
                            List<ItemStatistics> items,
                            List<Covariate> covariates) {}

    public record AggregationGroup(String id, String name, Domain domain,
                                   List<Aggregation> aggregations,
                                   List<Covariate> covariates) {}

    public record ScopedGroup(GroupData data, List<EquivalenceTableEntry> tables) {}
}
