package com.tba3.mock.generator;

import com.tba3.mock.booklet.BookletModels.Booklet;
import com.tba3.mock.generator.GeneratorModels.*;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class GroupGenerator {
    private final StudentGenerator studentGenerator;
    private final ResponseGenerator responseGenerator;

    public GroupGenerator(StudentGenerator studentGenerator, ResponseGenerator responseGenerator) {
        this.studentGenerator = studentGenerator;
        this.responseGenerator = responseGenerator;
    }

    public GroupData generate(String groupId,
                              Booklet booklet,
                              ClassProfile profile,
                              int studentCount,
                              List<CovariateDistribution> covariates,
                              String seed) {
        String effectiveSeed = seed != null ? seed : groupId;
        StudentTable students = studentGenerator.generate(studentCount, profile, effectiveSeed, covariates);
        ResponseMatrix responses = responseGenerator.generate(students, booklet, effectiveSeed);
        return new GroupData(groupId, booklet, students, responses, profile);
    }
}
