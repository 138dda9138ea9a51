package com.tba3.mock.api;

import com.tba3.mock.aggregation.AggregationModels;
import com.tba3.mock.service.ReportService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/states")
public class StatesController {
    private final ReportService reportService;

    public StatesController(ReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping("/{id}/competence-levels")
    public ResponseEntity<List<AggregationModels.CompetenceLevelGroup>> competenceLevels(@PathVariable String id,
                                                                                         @RequestParam(required = false) String comparison) {
        GroupsController.ignored(comparison, null);
        return ResponseEntity.ok(reportService.stateCompetenceLevels(id));
    }

    @GetMapping("/{id}/items")
    public ResponseEntity<List<AggregationModels.ItemGroup>> items(@PathVariable String id,
                                                                   @RequestParam(required = false) String comparison) {
        GroupsController.ignored(comparison, null);
        return ResponseEntity.ok(reportService.stateItems(id));
    }

    @GetMapping("/{id}/aggregations")
    public ResponseEntity<List<AggregationModels.AggregationGroup>> aggregations(@PathVariable String id,
                                                                                 @RequestParam(required = false) String comparison,
                                                                                 @RequestParam(required = false) String aggregation) {
        GroupsController.ignored(comparison, aggregation);
        return ResponseEntity.ok(reportService.stateAggregations(id));
    }
}
