package com.tba3.mock.api;

import com.tba3.mock.aggregation.AggregationModels;
import com.tba3.mock.service.ReportService;
import com.tba3.mock.service.RequestedTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/groups")
public class GroupsController {
    private static final Logger log = LoggerFactory.getLogger(GroupsController.class);

    private final ReportService reportService;

    public GroupsController(ReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping("/{id}/competence-levels")
    public ResponseEntity<List<AggregationModels.CompetenceLevelGroup>> competenceLevels(@PathVariable String id,
                                                                                         @RequestParam(required = false) String type,
                                                                                         @RequestParam(required = false) String comparison) {
        ignored(comparison, null);
        return ResponseEntity.ok(reportService.groupCompetenceLevels(id, RequestedTypes.parse(type)));
    }

    @GetMapping("/{id}/items")
    public ResponseEntity<List<AggregationModels.ItemGroup>> items(@PathVariable String id,
                                                                   @RequestParam(required = false) String type,
                                                                   @RequestParam(required = false) String comparison) {
        ignored(comparison, null);
        return ResponseEntity.ok(reportService.groupItems(id, RequestedTypes.parse(type)));
    }

    @GetMapping("/{id}/aggregations")
    public ResponseEntity<List<AggregationModels.AggregationGroup>> aggregations(@PathVariable String id,
                                                                                 @RequestParam(required = false) String type,
                                                                                 @RequestParam(required = false) String comparison,
                                                                                 @RequestParam(required = false) String aggregation) {
        ignored(comparison, aggregation);
        return ResponseEntity.ok(reportService.groupAggregations(id, RequestedTypes.parse(type)));
    }

    static void ignored(String comparison, String aggregation) {
        if (comparison != null || aggregation != null) {
            log.debug("Ignoring comparison={} aggregation={}", comparison, aggregation);
        }
    }
}
