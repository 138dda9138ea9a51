package com.tba3.mock.aggregation;

import com.tba3.mock.aggregation.AggregationModels.*;
import com.tba3.mock.generator.GeneratorModels.GroupData;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class StateAggregator {
    private final AggregationEngine engine;

    public StateAggregator(AggregationEngine engine) {
        this.engine = engine;
    }

    public List<CompetenceLevelGroup> competenceLevels(List<ScopedGroup> groups) {
        List<CompetenceLevelGroup> result = new ArrayList<>();
        for (ScopedGroup group : groups) {
            String booklet = group.data().booklet().key().toString();
            result.addAll(engine.competenceLevels(booklet, booklet, group.data(), group.tables()));
        }
        return result;
    }

    public List<ItemGroup> itemStatistics(List<GroupData> groups) {
        List<ItemGroup> result = new ArrayList<>();
        for (GroupData group : groups) {
            String booklet = group.booklet().key().toString();
            result.addAll(engine.itemStatistics(booklet, booklet, group.booklet(), group.responses()));
        }
        return result;
    }

    public List<AggregationGroup> domainAggregations(List<GroupData> groups) {
        List<AggregationGroup> result = new ArrayList<>();
        for (GroupData group : groups) {
            String booklet = group.booklet().key().toString();
            result.addAll(engine.domainAggregations(booklet, booklet, group));
        }
        return result;
    }
}
