package com.tba3.mock.aggregation;

import com.tba3.mock.aggregation.AggregationModels.*;
import com.tba3.mock.booklet.BookletModels.Item;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

final class Stats {
    static final String AGGREGATION_TYPE = "custom";

    private static final Map<String, String> SUBJECT_NAMES = Map.of(
            "de", "Deutsch",
            "ma", "Mathematik",
            "en", "Englisch",
            "fr", "Französisch");

    private Stats() {
    }

    static double mean(double[] values) {
        return round(new Mean().evaluate(values));
    }

    static double standardDeviation(double[] values) {
        return round(new StandardDeviation().evaluate(values));
    }

    static double round(double value) {
        if (Double.isNaN(value)) return 0.0;
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_EVEN).doubleValue();
    }

    static DescriptiveStatistics ofColumn(int[] column) {
        double[] values = new double[column.length];
        long frequency = 0;
        for (int i = 0; i < column.length; i++) {
            values[i] = column[i];
            frequency += column[i];
        }
        return new DescriptiveStatistics(column.length, mean(values), frequency, standardDeviation(values));
    }

    static String subjectName(String subjectCode) {
        return SUBJECT_NAMES.getOrDefault(subjectCode, subjectCode);
    }

    static Domain domain(String domain, String subjectCode) {
        String subject = subjectName(subjectCode);
        return new Domain(domain != null ? domain : subject, new Subject(subject));
    }

    static ItemParameters parameters(Item item) {
        return new ItemParameters(
                item.logit(),
                item.bista(),
                item.solutionFreqPrimarySchool(),
                item.solutionFreqGymnasium(),
                item.solutionFreqNonGymnasium(),
                // the item "subject" field carries the domain code
                item.domain(),
                item.domain(),
                new CompetenceLevelRef(item.competenceLevel()),
                item.competenceStandard(),
                item.listeningOrReadingStyle(),
                item.generalMathematicalCompetence(),
                item.coreIdea(),
                item.cognitiveDemandLevel());
    }
}
