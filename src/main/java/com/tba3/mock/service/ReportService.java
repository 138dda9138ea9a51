package com.tba3.mock.service;

import com.tba3.mock.aggregation.AggregationEngine;
import com.tba3.mock.aggregation.AggregationModels.*;
import com.tba3.mock.aggregation.SchoolAggregator;
import com.tba3.mock.aggregation.StateAggregator;
import com.tba3.mock.config.ConfigModels.SchoolConfig;
import com.tba3.mock.error.NotFoundException;
import com.tba3.mock.generator.GeneratorModels.GroupData;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class ReportService {
    private final GenerationService generation;
    private final AggregationEngine engine;
    private final SchoolAggregator schools;
    private final StateAggregator states;

    public ReportService(GenerationService generation,
                         AggregationEngine engine,
                         SchoolAggregator schools,
                         StateAggregator states) {
        this.generation = generation;
        this.engine = engine;
        this.schools = schools;
        this.states = states;
    }

    public List<CompetenceLevelGroup> groupCompetenceLevels(String groupId, RequestedTypes types) {
        ScopedGroup group = generation.resolveGroup(groupId);
        if (group.tables().isEmpty()) {
            throw new NotFoundException("No equivalence tables found for group: " + groupId);
        }
        List<CompetenceLevelGroup> result = new ArrayList<>();
        if (types.group()) result.addAll(engine.competenceLevels(group.data(), group.tables()));
        if (types.students()) result.addAll(engine.studentCompetenceLevels(group.data(), group.tables()));
        return result;
    }

    public List<ItemGroup> groupItems(String groupId, RequestedTypes types) {
        GroupData data = generation.resolveGroup(groupId).data();
        List<ItemGroup> result = new ArrayList<>();
        if (types.group()) result.addAll(engine.itemStatistics(data));
        if (types.students()) result.addAll(engine.studentItemStatistics(data));
        return result;
    }

    public List<AggregationGroup> groupAggregations(String groupId, RequestedTypes types) {
        GroupData data = generation.resolveGroup(groupId).data();
        List<AggregationGroup> result = new ArrayList<>();
        if (types.group()) result.addAll(engine.domainAggregations(data));
        if (types.students()) result.addAll(engine.studentAggregations(data));
        return result;
    }

    public List<CompetenceLevelGroup> schoolCompetenceLevels(String schoolId) {
        List<ScopedGroup> groups = generation.resolveSchool(schoolId);
        if (groups.stream().allMatch(g -> g.tables().isEmpty())) {
            throw new NotFoundException("No equivalence tables found for school: " + schoolId);
        }
        SchoolConfig school = generation.school(schoolId);
        List<CompetenceLevelGroup> result = new ArrayList<>(
                schools.competenceLevels(schoolId, school.displayName(), groups));
        groups.forEach(g -> result.addAll(engine.competenceLevels(g.data(), g.tables())));
        return result;
    }

    public List<ItemGroup> schoolItems(String schoolId) {
        List<GroupData> groups = schoolGroups(schoolId);
        List<ItemGroup> result = new ArrayList<>(
                schools.itemStatistics(schoolId, generation.school(schoolId).displayName(), groups));
        groups.forEach(g -> result.addAll(engine.itemStatistics(g)));
        return result;
    }

    public List<AggregationGroup> schoolAggregations(String schoolId) {
        List<GroupData> groups = schoolGroups(schoolId);
        List<AggregationGroup> result = new ArrayList<>(
                schools.domainAggregations(schoolId, generation.school(schoolId).displayName(), groups));
        groups.forEach(g -> result.addAll(engine.domainAggregations(g)));
        return result;
    }

    public List<CompetenceLevelGroup> stateCompetenceLevels(String stateId) {
        List<ScopedGroup> groups = generation.resolveState(stateId);
        if (groups.stream().allMatch(g -> g.tables().isEmpty())) {
            throw new NotFoundException("No equivalence tables found for state: " + stateId);
        }
        return states.competenceLevels(groups);
    }

    public List<ItemGroup> stateItems(String stateId) {
        return states.itemStatistics(stateGroups(stateId));
    }

    public List<AggregationGroup> stateAggregations(String stateId) {
        return states.domainAggregations(stateGroups(stateId));
    }

    private List<GroupData> schoolGroups(String schoolId) {
        return generation.resolveSchool(schoolId).stream().map(ScopedGroup::data).toList();
    }

    private List<GroupData> stateGroups(String stateId) {
        return generation.resolveState(stateId).stream().map(ScopedGroup::data).toList();
    }
}
