package com.tba3.mock.equivalence;

import com.tba3.mock.booklet.BookletModels.Item;
import com.tba3.mock.config.ConfigModels.CompetenceLevelRange;
import com.tba3.mock.config.ConfigModels.EquivalenceTableEntry;
import com.tba3.mock.error.DataIntegrityException;
import com.tba3.mock.generator.GeneratorModels.GroupData;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class EquivalenceMatcher {

    public Optional<String> match(int rawScore, EquivalenceTableEntry entry) {
        for (CompetenceLevelRange level : entry.competenceLevels()) {
            if (level.minScore() <= rawScore && rawScore <= level.maxScore()) {
                return Optional.of(level.nameShort());
            }
        }
        return Optional.empty();
    }

    /**
     * @throws DataIntegrityException if no level covers the score
     */
    public String classify(int rawScore, EquivalenceTableEntry entry) {
        return match(rawScore, entry).orElseThrow(() -> new DataIntegrityException(
                "Raw score " + rawScore + " matches no competence level of table " + entry.booklet()
                        + (entry.domain() != null ? " domain=" + entry.domain() : "")));
    }

    public int[] rawScores(GroupData group, EquivalenceTableEntry entry) {
        List<Item> scope = group.booklet().itemsInScope(entry.domain());
        return group.responses().rawScores(scope);
    }
}
