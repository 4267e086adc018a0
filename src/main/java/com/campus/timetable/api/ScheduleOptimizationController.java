package com.campus.timetable.api;

import com.campus.timetable.optimizer.OptimizerModels;
import com.campus.timetable.optimizer.ScheduleOptimizerService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/schedules")
public class ScheduleOptimizationController {
    private final ScheduleOptimizerService optimizerService;

    public ScheduleOptimizationController(ScheduleOptimizerService optimizerService) {
        this.optimizerService = optimizerService;
    }

    @PostMapping("/optimize")
    public ResponseEntity<OptimizerModels.ScheduleOptimization> optimize(@RequestBody OptimizerModels.OptimizationRequest request) {
        return ResponseEntity.ok(optimizerService.optimize(request));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }
}
