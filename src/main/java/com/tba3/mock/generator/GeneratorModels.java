package com.tba3.mock.generator;

import com.tba3.mock.booklet.BookletModels.Booklet;

import java.util.*;

public class GeneratorModels {

    public record ClassProfile(String name, double abilityMean, double abilityStd) {
        public ClassProfile {
            if (!(abilityStd > 0) || Double.isInfinite(abilityStd)) {
                throw new IllegalArgumentException("abilityStd must be a positive finite number, got " + abilityStd);
            }
            if (!Double.isFinite(abilityMean)) {
                throw new IllegalArgumentException("abilityMean must be finite, got " + abilityMean);
            }
        }
    }

    public record CovariateDistribution(String typeName, List<String> categories, List<Double> probabilities) {
        private static final double SUM_TOLERANCE = 1e-9;

        public CovariateDistribution {
            if (typeName == null || typeName.isBlank()) {
                throw new IllegalArgumentException("covariate type name must not be blank");
            }
            categories = List.copyOf(categories);
            probabilities = List.copyOf(probabilities);
            if (categories.isEmpty()) {
                throw new IllegalArgumentException("covariate '" + typeName + "' has no categories");
            }
            if (categories.size() != probabilities.size()) {
                throw new IllegalArgumentException("categories and probabilities must have same length");
            }
            if (probabilities.stream().anyMatch(p -> p < 0 || p.isNaN())) {
                throw new IllegalArgumentException("probabilities must be non-negative");
            }
            if (!sumsToOne(probabilities)) {
                throw new IllegalArgumentException("probabilities must sum to 1.0");
            }
        }

        public static boolean sumsToOne(List<Double> probabilities) {
            double sum = 0.0;
            double compensation = 0.0;
            for (double p : probabilities) {
                double y = p - compensation;
                double t = sum + y;
                compensation = (t - sum) - y;
                sum = t;
            }
            return Math.abs(sum - 1.0) <= SUM_TOLERANCE;
        }

        double[] probabilityArray() {
            return probabilities.stream().mapToDouble(Double::doubleValue).toArray();
        }
    }

    public record Student(String id, String name, double ability, Map<String, String> covariates) {
        public Student {
            covariates = Collections.unmodifiableMap(new LinkedHashMap<>(covariates));
        }
    }

    public record StudentTable(List<Student> students, List<String> covariateTypes) {
        public StudentTable {
            students = List.copyOf(students);
            covariateTypes = List.copyOf(covariateTypes);
        }

        public int size() {
            return students.size();
        }

        public List<String> ids() {
            return students.stream().map(Student::id).toList();
        }

        public double[] abilities() {
            return students.stream().mapToDouble(Student::ability).toArray();
        }
    }

    public record GroupData(String groupId,
                            Booklet booklet,
                            StudentTable students,
                            ResponseMatrix responses,
                            ClassProfile profile) {}
}
