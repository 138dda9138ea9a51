package com.tba3.mock.generator;

import com.tba3.mock.booklet.BookletModels.Booklet;
import com.tba3.mock.booklet.BookletModels.Item;
import com.tba3.mock.error.ComputationPreconditionException;
import com.tba3.mock.generator.GeneratorModels.Student;
import com.tba3.mock.generator.GeneratorModels.StudentTable;
import org.apache.commons.rng.UniformRandomProvider;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
public class ResponseGenerator {

    public ResponseMatrix generate(StudentTable students, Booklet booklet, String seed) {
        checkStudents(students);
        if (booklet == null || booklet.itemCount() == 0) {
            throw new ComputationPreconditionException("booklet must contain at least one item");
        }
        List<Item> items = booklet.itemsSorted();
        Set<String> seen = new HashSet<>();
        for (Item item : items) {
            if (!seen.add(item.iqbItemId())) {
                throw new ComputationPreconditionException("booklet " + booklet.key()
                        + " contains item " + item.iqbItemId() + " more than once");
            }
        }

        double[] abilities = students.abilities();
        double[] difficulties = items.stream().mapToDouble(Item::logit).toArray();
        int nStudents = abilities.length;
        int nItems = difficulties.length;

        double[][] failure = new double[nStudents][nItems];
        for (int s = 0; s < nStudents; s++) {
            for (int i = 0; i < nItems; i++) {
                failure[s][i] = 1.0 / (1.0 + Math.exp(abilities[s] - difficulties[i]));
            }
        }

        UniformRandomProvider rng = SeededStreams.responseStream(seed, nStudents, nItems);
        double[][] draws = new double[nStudents][nItems];
        for (int s = 0; s < nStudents; s++) {
            for (int i = 0; i < nItems; i++) {
                draws[s][i] = rng.nextDouble();
            }
        }

        int[][] scores = new int[nStudents][nItems];
        for (int s = 0; s < nStudents; s++) {
            for (int i = 0; i < nItems; i++) {
                scores[s][i] = draws[s][i] > failure[s][i] ? 1 : 0;
            }
        }
        return new ResponseMatrix(items, scores);
    }

    private void checkStudents(StudentTable students) {
        if (students == null || students.size() == 0) {
            throw new ComputationPreconditionException("student table must contain at least one student");
        }
        for (Student student : students.students()) {
            if (student.id() == null || student.id().isBlank()) {
                throw new ComputationPreconditionException("student table has a row without id");
            }
            if (!Double.isFinite(student.ability())) {
                throw new ComputationPreconditionException("student " + student.id() + " has no finite ability");
            }
        }
    }
}
