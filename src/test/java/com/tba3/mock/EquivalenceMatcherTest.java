package com.tba3.mock;

import com.tba3.mock.booklet.BookletModels.Booklet;
import com.tba3.mock.config.ConfigModels.EquivalenceTableEntry;
import com.tba3.mock.equivalence.EquivalenceMatcher;
import com.tba3.mock.error.DataIntegrityException;
import com.tba3.mock.generator.GeneratorModels.GroupData;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.tba3.mock.TestBooklets.*;
import static org.junit.jupiter.api.Assertions.*;

class EquivalenceMatcherTest {
    private final EquivalenceMatcher matcher = new EquivalenceMatcher();
    private final EquivalenceTableEntry reading = table("V3-2024-DE-TH1", "LE", level("I", 0, 1), level("II", 2, 4));

    @Test
    void everyScoreInRangeMatchesExactlyOneLevel() {
        assertEquals("I", matcher.classify(0, reading));
        assertEquals("I", matcher.classify(1, reading));
        assertEquals("II", matcher.classify(2, reading));
        assertEquals("II", matcher.classify(4, reading));
    }

    @Test
    void uncoveredScoreIsAnIntegrityError() {
        assertEquals(Optional.empty(), matcher.match(5, reading));
        assertThrows(DataIntegrityException.class, () -> matcher.classify(5, reading));
    }

    @Test
    void rawScoresAreTakenOverTheTableDomainOnly() {
        Booklet booklet = booklet("V3-2024-DE-TH1",
                item("D1", "LE", 1, 0), item("D2", "LE", 2, 0), item("D3", "LE", 3, 0), item("D4", "LE", 4, 0),
                item("H1", "ZU", 5, 0));
        GroupData group = group("3a", booklet, new int[][]{
                {0, 0, 0, 0, 1},
                {1, 0, 0, 0, 1},
                {1, 1, 0, 0, 0},
                {1, 1, 1, 1, 1}});

        assertArrayEquals(new int[]{0, 1, 2, 4}, matcher.rawScores(group, reading));
        assertArrayEquals(new int[]{1, 2, 2, 5},
                matcher.rawScores(group, table("V3-2024-DE-TH1", null, level("I", 0, 5))));
    }
}
