package com.boxsort.controller;

import com.boxsort.model.PerformanceMetrics;
import com.boxsort.service.ErrorKind;
import com.boxsort.service.PerformanceCalculator;
import com.boxsort.service.ScanCoordinationException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/performance")
public class PerformanceController {

    @Autowired
    private PerformanceCalculator performanceCalculator;

    @GetMapping
    public ResponseEntity<PerformanceMetrics> performance(
            @RequestParam(required = false) Long sessionId,
            @RequestParam(required = false) String jobId,
            @RequestParam(required = false) String workerId) {
        if (sessionId != null) {
            return ResponseEntity.ok(performanceCalculator.compute(sessionId));
        }
        if (jobId != null && workerId != null) {
            return ResponseEntity.ok(performanceCalculator.compute(jobId, workerId));
        }
        throw new ScanCoordinationException(ErrorKind.INVALID_REQUEST,
            "Either sessionId or both jobId and workerId are required", jobId, null, null);
    }
}
