package com.tba3.mock.config;

import com.tba3.mock.booklet.BookletCatalog;
import com.tba3.mock.booklet.BookletKey;
import com.tba3.mock.config.ConfigModels.*;
import com.tba3.mock.error.ConfigValidationException;
import com.tba3.mock.generator.GeneratorModels.CovariateDistribution;
import com.tba3.mock.validation.ConfigValidator;
import com.tba3.mock.validation.ValidationIssue;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

public final class ConfigStore {
    private final Map<String, CovariateConfig> groupDefaults;
    private final Map<String, CovariateConfig> stateDefaults;
    private final Map<String, GroupConfig> groups;
    private final Map<String, SchoolConfig> schools;
    private final Map<String, StateConfig> states;
    private final List<EquivalenceTableEntry> equivalenceTables;

    private ConfigStore(GroupsFile groupsFile, SchoolsFile schoolsFile, StatesFile statesFile, EquivalenceTablesFile tablesFile) {
        this.groupDefaults = defaults(groupsFile.defaults());
        this.stateDefaults = defaults(statesFile.defaults());
        this.groups = index(groupsFile.groups(), GroupConfig::id);
        this.schools = index(schoolsFile.schools(), SchoolConfig::id);
        this.states = index(statesFile.states(), StateConfig::id);
        this.equivalenceTables = tablesFile.tables() == null ? List.of() : List.copyOf(tablesFile.tables());
    }

    public static ConfigStore of(GroupsFile groups,
                                 SchoolsFile schools,
                                 StatesFile states,
                                 EquivalenceTablesFile tables,
                                 BookletCatalog catalog,
                                 ConfigValidator validator) {
        List<ValidationIssue> issues = validator.validate(groups, schools, states, tables, catalog);
        if (!issues.isEmpty()) {
            throw new ConfigValidationException(issues);
        }
        return new ConfigStore(groups, schools, states, tables);
    }

    public static ConfigStore empty() {
        return new ConfigStore(GroupsFile.empty(), SchoolsFile.empty(), StatesFile.empty(), EquivalenceTablesFile.empty());
    }

    public Optional<GroupConfig> group(String id) {
        return Optional.ofNullable(groups.get(id));
    }

    public Optional<SchoolConfig> school(String id) {
        return Optional.ofNullable(schools.get(id));
    }

    public Optional<StateConfig> state(String id) {
        return Optional.ofNullable(states.get(id));
    }

    public Collection<GroupConfig> groups() {
        return groups.values();
    }

    public Collection<SchoolConfig> schools() {
        return schools.values();
    }

    public Collection<StateConfig> states() {
        return states.values();
    }

    public List<EquivalenceTableEntry> equivalenceTables(BookletKey booklet) {
        return equivalenceTables.stream()
                .filter(e -> e.bookletKey().equals(booklet))
                .toList();
    }

    public int equivalenceTableCount() {
        return equivalenceTables.size();
    }

    public List<CovariateDistribution> covariatesFor(GroupConfig group) {
        return merge(groupDefaults, group.covariates());
    }

    public List<CovariateDistribution> covariatesFor(StateConfig state) {
        return merge(stateDefaults, state.covariates());
    }

    /** An entity covariate replaces the default of the same type and keeps the default's position. */
    static List<CovariateDistribution> merge(Map<String, CovariateConfig> defaults, Map<String, CovariateConfig> own) {
        Map<String, CovariateConfig> merged = new LinkedHashMap<>(defaults);
        if (own != null) {
            merged.putAll(own);
        }
        return merged.entrySet().stream()
                .map(e -> new CovariateDistribution(e.getKey(), e.getValue().categories(), e.getValue().probabilities()))
                .toList();
    }

    private static Map<String, CovariateConfig> defaults(DefaultsConfig defaults) {
        if (defaults == null || defaults.covariates() == null) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(defaults.covariates()));
    }

    private static <T> Map<String, T> index(List<T> values, Function<T, String> id) {
        if (values == null) return Map.of();
        return Collections.unmodifiableMap(values.stream()
                .collect(Collectors.toMap(id, v -> v, (a, b) -> a, LinkedHashMap::new)));
    }
}
