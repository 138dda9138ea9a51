package com.tba3.mock.generator;

import com.tba3.mock.error.ComputationPreconditionException;
import com.tba3.mock.generator.GeneratorModels.*;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.GaussianSampler;
import org.apache.commons.rng.sampling.distribution.GuideTableDiscreteSampler;
import org.apache.commons.rng.sampling.distribution.SharedStateDiscreteSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Synthesizes a student population from one seeded stream.
 *
 * <p>Draw order is fixed: ids, then adjectives, nouns and numbers for the names, then abilities,
 * then one block of categorical draws per covariate in configured order. Reordering or adding
 * covariates therefore changes every later draw.</p>
 */
@Component
public class StudentGenerator {
    private static final List<String> ADJECTIVES = List.of(
            "schnell", "langsam", "gross", "klein", "hell", "dunkel", "leise", "laut", "warm", "kalt",
            "neu", "alt", "jung", "weit", "nah", "hoch", "tief", "breit", "schmal", "rund");
    private static final List<String> NOUNS = List.of(
            "apfel", "birne", "kirsche", "banane", "orange", "traube", "pflaume", "himbeere", "erdbeere", "zitrone",
            "baum", "blume", "wolke", "stern", "mond", "sonne", "berg", "fluss", "wald", "wiese");

    public StudentTable generate(int count, ClassProfile profile, String seed, List<CovariateDistribution> covariates) {
        if (count < 1) {
            throw new ComputationPreconditionException("count must be at least 1, got " + count);
        }
        if (seed == null) {
            throw new ComputationPreconditionException("seed must not be null");
        }
        UniformRandomProvider rng = SeededStreams.studentStream(seed);

        String[] ids = new String[count];
        for (int i = 0; i < count; i++) {
            ids[i] = new UUID(rng.nextLong(), rng.nextLong()).toString();
        }

        String[] adjectives = new String[count];
        for (int i = 0; i < count; i++) {
            adjectives[i] = ADJECTIVES.get(rng.nextInt(ADJECTIVES.size()));
        }
        String[] nouns = new String[count];
        for (int i = 0; i < count; i++) {
            nouns[i] = NOUNS.get(rng.nextInt(NOUNS.size()));
        }
        int[] numbers = new int[count];
        for (int i = 0; i < count; i++) {
            numbers[i] = 10 + rng.nextInt(90);
        }

        ContinuousSampler normal = GaussianSampler.of(ZigguratSampler.NormalizedGaussian.of(rng),
                profile.abilityMean(), profile.abilityStd());
        double[] abilities = new double[count];
        for (int i = 0; i < count; i++) {
            abilities[i] = normal.sample();
        }

        List<String> types = new ArrayList<>();
        List<String[]> covariateValues = new ArrayList<>();
        for (CovariateDistribution covariate : covariates) {
            SharedStateDiscreteSampler categorical = GuideTableDiscreteSampler.of(rng, covariate.probabilityArray());
            String[] values = new String[count];
            for (int i = 0; i < count; i++) {
                values[i] = covariate.categories().get(categorical.sample());
            }
            types.add(covariate.typeName());
            covariateValues.add(values);
        }

        List<Student> students = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Map<String, String> row = new LinkedHashMap<>();
            for (int c = 0; c < types.size(); c++) {
                row.put(types.get(c), covariateValues.get(c)[i]);
            }
            students.add(new Student(ids[i], adjectives[i] + "." + nouns[i] + "." + numbers[i], abilities[i], row));
        }
        return new StudentTable(students, types);
    }
}
