package com.tba3.mock.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tba3.mock.booklet.BookletKey;

import java.util.List;
import java.util.Map;

public class ConfigModels {
    public record CovariateConfig(List<String> categories, List<Double> probabilities) {}

    public record DefaultsConfig(Map<String, CovariateConfig> covariates) {}

    public record GroupConfig(String id,
                              String name,
                              String booklet,
                              @JsonProperty("ability_mean") Double abilityMean,
                              @JsonProperty("ability_std") Double abilityStd,
                              Integer size,
                              String seed,
                              Map<String, CovariateConfig> covariates) {
        public BookletKey bookletKey() {
            return BookletKey.parse(booklet);
        }

        public String displayName() {
            return name != null ? name : "Lerngruppe " + id;
        }
    }

    public record GroupsFile(DefaultsConfig defaults, List<GroupConfig> groups) {
        public static GroupsFile empty() {
            return new GroupsFile(null, List.of());
        }
    }

    public record SchoolConfig(String id, String name, List<String> groups) {
        public String displayName() {
            return name != null ? name : "Schule " + id;
        }
    }

    public record SchoolsFile(List<SchoolConfig> schools) {
        public static SchoolsFile empty() {
            return new SchoolsFile(List.of());
        }
    }

    public record StateConfig(String id,
                              String name,
                              List<String> booklets,
                              @JsonProperty("ability_mean") Double abilityMean,
                              @JsonProperty("ability_std") Double abilityStd,
                              Integer size,
                              String seed,
                              Map<String, CovariateConfig> covariates) {
        public String displayName() {
            return name != null ? name : "Bundesland " + id;
        }
    }

    public record StatesFile(DefaultsConfig defaults, List<StateConfig> states) {
        public static StatesFile empty() {
            return new StatesFile(null, List.of());
        }
    }

    public record CompetenceLevelRange(@JsonProperty("name_short") String nameShort,
                                       String name,
                                       String description,
                                       @JsonProperty("min_score") Integer minScore,
                                       @JsonProperty("max_score") Integer maxScore) {}

    public record EquivalenceTableEntry(String booklet,
                                        String domain,
                                        @JsonProperty("competence_levels") List<CompetenceLevelRange> competenceLevels) {
        public BookletKey bookletKey() {
            return BookletKey.parse(booklet);
        }
    }

    public record EquivalenceTablesFile(List<EquivalenceTableEntry> tables) {
        public static EquivalenceTablesFile empty() {
            return new EquivalenceTablesFile(List.of());
        }
    }
}
