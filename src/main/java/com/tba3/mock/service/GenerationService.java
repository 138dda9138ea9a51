package com.tba3.mock.service;

import com.tba3.mock.aggregation.AggregationModels.ScopedGroup;
import com.tba3.mock.booklet.BookletCatalog;
import com.tba3.mock.booklet.BookletKey;
import com.tba3.mock.booklet.BookletModels.Booklet;
import com.tba3.mock.config.ConfigModels.GroupConfig;
import com.tba3.mock.config.ConfigModels.SchoolConfig;
import com.tba3.mock.config.ConfigModels.StateConfig;
import com.tba3.mock.config.ConfigStore;
import com.tba3.mock.error.NotFoundException;
import com.tba3.mock.generator.GeneratorModels.ClassProfile;
import com.tba3.mock.generator.GeneratorModels.GroupData;
import com.tba3.mock.generator.GroupGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class GenerationService {
    private static final Logger log = LoggerFactory.getLogger(GenerationService.class);

    private final BookletCatalog catalog;
    private final ConfigStore config;
    private final GroupGenerator generator;

    public GenerationService(BookletCatalog catalog, ConfigStore config, GroupGenerator generator) {
        this.catalog = catalog;
        this.config = config;
        this.generator = generator;
    }

    public ScopedGroup resolveGroup(String groupId) {
        GroupConfig group = config.group(groupId)
                .orElseThrow(() -> new NotFoundException("Group not found: " + groupId));
        BookletKey key = group.bookletKey();
        Booklet booklet = booklet(key);
        ClassProfile profile = new ClassProfile(group.displayName(), group.abilityMean(), group.abilityStd());
        GroupData data = generator.generate(groupId, booklet, profile, group.size(), config.covariatesFor(group), group.seed());
        log.debug("Generated group {} with {} students on {}", groupId, group.size(), key);
        return new ScopedGroup(data, config.equivalenceTables(key));
    }

    public SchoolConfig school(String schoolId) {
        return config.school(schoolId)
                .orElseThrow(() -> new NotFoundException("School not found: " + schoolId));
    }

    public List<ScopedGroup> resolveSchool(String schoolId) {
        return school(schoolId).groups().stream().map(this::resolveGroup).toList();
    }

    public List<ScopedGroup> resolveState(String stateId) {
        StateConfig state = config.state(stateId)
                .orElseThrow(() -> new NotFoundException("State not found: " + stateId));
        ClassProfile profile = new ClassProfile(state.displayName(), state.abilityMean(), state.abilityStd());

        List<ScopedGroup> result = new ArrayList<>();
        for (String bookletRef : state.booklets()) {
            BookletKey key = BookletKey.parse(bookletRef);
            Booklet booklet = booklet(key);
            GroupData data = generator.generate(stateId + ":" + bookletRef, booklet, profile, state.size(),
                    config.covariatesFor(state), state.seed() + "-" + bookletRef);
            result.add(new ScopedGroup(data, config.equivalenceTables(key)));
        }
        return result;
    }

    private Booklet booklet(BookletKey key) {
        return catalog.get(key).orElseThrow(() -> new NotFoundException("Booklet not found: " + key));
    }
}
