package com.tba3.mock.validation;

import com.tba3.mock.booklet.BookletCatalog;
import com.tba3.mock.booklet.BookletKey;
import com.tba3.mock.booklet.BookletModels.Booklet;
import com.tba3.mock.config.ConfigModels.*;
import com.tba3.mock.generator.GeneratorModels.CovariateDistribution;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Component
public class ConfigValidator {
    static final String GROUPS = "groups.yml";
    static final String SCHOOLS = "schools.yml";
    static final String STATES = "states.yml";
    static final String EQUIVALENCE = "equivalence_tables.yml";

    public List<ValidationIssue> validate(GroupsFile groups,
                                          SchoolsFile schools,
                                          StatesFile states,
                                          EquivalenceTablesFile tables,
                                          BookletCatalog catalog) {
        List<ValidationIssue> issues = new ArrayList<>();
        validateGroups(groups, issues);
        validateSchools(schools, issues);
        validateStates(states, issues);
        validateEquivalenceTables(tables, catalog, issues);
        return issues;
    }

    private void validateGroups(GroupsFile file, List<ValidationIssue> issues) {
        List<GroupConfig> groups = nonNull(file.groups());
        duplicate(groups.stream().map(GroupConfig::id).toList(), "DUPLICATE_GROUP", GROUPS, issues);
        if (file.defaults() != null) {
            covariates(file.defaults().covariates(), GROUPS, "defaults", issues);
        }
        for (GroupConfig g : groups) {
            required(g.id(), "id", GROUPS, g.id(), issues);
            required(g.seed(), "seed", GROUPS, g.id(), issues);
            bookletKey(g.booklet(), GROUPS, g.id(), issues);
            population(g.abilityMean(), g.abilityStd(), g.size(), GROUPS, g.id(), issues);
            covariates(g.covariates(), GROUPS, g.id(), issues);
        }
    }

    private void validateSchools(SchoolsFile file, List<ValidationIssue> issues) {
        List<SchoolConfig> schools = nonNull(file.schools());
        duplicate(schools.stream().map(SchoolConfig::id).toList(), "DUPLICATE_SCHOOL", SCHOOLS, issues);
        for (SchoolConfig s : schools) {
            required(s.id(), "id", SCHOOLS, s.id(), issues);
            if (s.groups() == null || s.groups().isEmpty()) {
                issues.add(new ValidationIssue("EMPTY_SCHOOL", "School must list at least one group", SCHOOLS, s.id()));
            }
        }
    }

    private void validateStates(StatesFile file, List<ValidationIssue> issues) {
        List<StateConfig> states = nonNull(file.states());
        duplicate(states.stream().map(StateConfig::id).toList(), "DUPLICATE_STATE", STATES, issues);
        if (file.defaults() != null) {
            covariates(file.defaults().covariates(), STATES, "defaults", issues);
        }
        for (StateConfig s : states) {
            required(s.id(), "id", STATES, s.id(), issues);
            required(s.seed(), "seed", STATES, s.id(), issues);
            if (s.booklets() == null || s.booklets().isEmpty()) {
                issues.add(new ValidationIssue("EMPTY_STATE", "State must list at least one booklet", STATES, s.id()));
            } else {
                s.booklets().forEach(b -> bookletKey(b, STATES, s.id(), issues));
            }
            population(s.abilityMean(), s.abilityStd(), s.size(), STATES, s.id(), issues);
            covariates(s.covariates(), STATES, s.id(), issues);
        }
    }

    private void validateEquivalenceTables(EquivalenceTablesFile file, BookletCatalog catalog, List<ValidationIssue> issues) {
        Set<String> seen = new HashSet<>();
        for (EquivalenceTableEntry entry : nonNull(file.tables())) {
            String id = entry.booklet() + (entry.domain() != null ? " domain=" + entry.domain() : "");
            BookletKey key = bookletKey(entry.booklet(), EQUIVALENCE, id, issues);
            if (key != null && !seen.add(key + "|" + entry.domain())) {
                issues.add(new ValidationIssue("DUPLICATE_TABLE", "More than one equivalence table for " + id, EQUIVALENCE, id));
            }
            if (!ranges(entry.competenceLevels(), id, issues) || key == null) {
                continue;
            }
            Optional<Booklet> booklet = catalog.get(key);
            if (booklet.isEmpty()) {
                issues.add(new ValidationIssue("BOOKLET_NOT_FOUND", "Unknown booklet: " + entry.booklet(), EQUIVALENCE, id));
                continue;
            }
            int itemCount = booklet.get().itemsInScope(entry.domain()).size();
            CompetenceLevelRange last = entry.competenceLevels().get(entry.competenceLevels().size() - 1);
            if (last.maxScore() != itemCount) {
                issues.add(new ValidationIssue("ITEM_COUNT_MISMATCH",
                        "Last level '" + last.nameShort() + "' has max_score=" + last.maxScore()
                                + ", but booklet has " + itemCount + " items", EQUIVALENCE, id));
            }
        }
    }

    private boolean ranges(List<CompetenceLevelRange> levels, String id, List<ValidationIssue> issues) {
        if (levels == null || levels.isEmpty()) {
            issues.add(new ValidationIssue("EMPTY_TABLE", "competence_levels must not be empty", EQUIVALENCE, id));
            return false;
        }
        int before = issues.size();
        for (int i = 0; i < levels.size(); i++) {
            CompetenceLevelRange level = levels.get(i);
            if (level.nameShort() == null || level.minScore() == null || level.maxScore() == null) {
                issues.add(new ValidationIssue("MISSING_FIELD", "Level " + i + " needs name_short, min_score and max_score", EQUIVALENCE, id));
                return false;
            }
            if (level.minScore() < 0) {
                issues.add(new ValidationIssue("NEGATIVE_SCORE", "Level '" + level.nameShort() + "' has min_score < 0", EQUIVALENCE, id));
            }
            if (level.minScore() > level.maxScore()) {
                issues.add(new ValidationIssue("INVERTED_RANGE", "Level '" + level.nameShort() + "': min_score ("
                        + level.minScore() + ") > max_score (" + level.maxScore() + ")", EQUIVALENCE, id));
            }
            if (i == 0 && level.minScore() != 0) {
                issues.add(new ValidationIssue("UNCOVERED_SCORE", "First level '" + level.nameShort()
                        + "' must start at 0, got " + level.minScore(), EQUIVALENCE, id));
            }
            if (i > 0) {
                CompetenceLevelRange prev = levels.get(i - 1);
                if (prev.maxScore() != null && level.minScore() != prev.maxScore() + 1) {
                    issues.add(new ValidationIssue("NON_CONTIGUOUS_RANGE", "Gap or overlap between '" + prev.nameShort()
                            + "' (max=" + prev.maxScore() + ") and '" + level.nameShort() + "' (min=" + level.minScore() + ")",
                            EQUIVALENCE, id));
                }
            }
        }
        return issues.size() == before;
    }

    private void population(Double mean, Double std, Integer size, String source, String id, List<ValidationIssue> issues) {
        if (mean == null || !Double.isFinite(mean)) {
            issues.add(new ValidationIssue("MISSING_FIELD", "ability_mean is required", source, id));
        }
        if (std == null || !(std > 0) || Double.isInfinite(std)) {
            issues.add(new ValidationIssue("INVALID_FIELD", "ability_std must be greater than 0", source, id));
        }
        if (size == null || size < 1) {
            issues.add(new ValidationIssue("INVALID_FIELD", "size must be at least 1", source, id));
        }
    }

    private void covariates(Map<String, CovariateConfig> covariates, String source, String id, List<ValidationIssue> issues) {
        if (covariates == null) return;
        covariates.forEach((type, cov) -> {
            List<String> categories = cov == null || cov.categories() == null ? List.of() : cov.categories();
            List<Double> probabilities = cov == null || cov.probabilities() == null ? List.of() : cov.probabilities();
            if (categories.isEmpty()) {
                issues.add(new ValidationIssue("INVALID_COVARIATE", "Covariate '" + type + "' has no categories", source, id));
            } else if (categories.size() != probabilities.size()) {
                issues.add(new ValidationIssue("INVALID_COVARIATE",
                        "Covariate '" + type + "': categories and probabilities must have same length", source, id));
            } else if (probabilities.stream().anyMatch(p -> p == null || p < 0 || p.isNaN())) {
                issues.add(new ValidationIssue("INVALID_COVARIATE",
                        "Covariate '" + type + "': probabilities must be non-negative", source, id));
            } else if (!CovariateDistribution.sumsToOne(probabilities)) {
                issues.add(new ValidationIssue("INVALID_COVARIATE",
                        "Covariate '" + type + "': probabilities must sum to 1.0", source, id));
            }
        });
    }

    private BookletKey bookletKey(String value, String source, String id, List<ValidationIssue> issues) {
        try {
            return BookletKey.parse(value);
        } catch (IllegalArgumentException e) {
            issues.add(new ValidationIssue("INVALID_BOOKLET", e.getMessage(), source, id));
            return null;
        }
    }

    private void required(String value, String field, String source, String id, List<ValidationIssue> issues) {
        if (value == null || value.isBlank()) {
            issues.add(new ValidationIssue("MISSING_FIELD", field + " is required", source, id));
        }
    }

    private void duplicate(List<String> ids, String code, String source, List<ValidationIssue> issues) {
        Map<String, Long> counts = ids.stream().filter(Objects::nonNull)
                .collect(Collectors.groupingBy(v -> v, LinkedHashMap::new, Collectors.counting()));
        counts.forEach((id, count) -> {
            if (count > 1) {
                issues.add(new ValidationIssue(code, "Duplicate id: " + id, source, id));
            }
        });
    }

    private static <T> List<T> nonNull(List<T> values) {
        return values == null ? List.of() : values;
    }
}
