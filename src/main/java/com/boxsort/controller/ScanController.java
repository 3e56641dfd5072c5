package com.boxsort.controller;

import com.boxsort.model.ScanEvent;
import com.boxsort.service.ScanEventProcessor;
import com.boxsort.service.UndoCoordinator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api")
public class ScanController {

    @Autowired
    private ScanEventProcessor scanEventProcessor;

    @Autowired
    private UndoCoordinator undoCoordinator;

    @PostMapping("/scan")
    public ResponseEntity<Map<String, Object>> scan(@Valid @RequestBody ScanRequest request) {
        ScanEvent event = scanEventProcessor.process(request.sessionId(), request.barCode());
        return ResponseEntity.ok(toEventMap(event));
    }

    @PostMapping("/undo")
    public ResponseEntity<Map<String, Object>> undo(@Valid @RequestBody UndoRequest request) {
        int count = request.count() != null ? request.count() : 1;
        List<ScanEvent> undone = undoCoordinator.undo(request.sessionId(), count);
        Map<String, Object> body = new HashMap<>();
        body.put("undoneEvents", undone.stream().map(ScanController::toEventMap).collect(Collectors.toList()));
        body.put("count", undone.size());
        return ResponseEntity.ok(body);
    }

    /**
     * Event as returned to the scanning device. {@code outcome} tells the worker
     * which of the three signals to give: accepted, extra item, or system error.
     */
    static Map<String, Object> toEventMap(ScanEvent event) {
        Map<String, Object> map = new HashMap<>();
        map.put("id", event.getId());
        map.put("sessionId", event.getSessionId());
        map.put("barCode", event.getBarCode());
        map.put("productName", event.getProductName());
        map.put("customerName", event.getCustomerName());
        map.put("boxNumber", event.getBoxNumber());
        map.put("eventType", event.getEventType().getWireName());
        map.put("isExtraItem", event.isExtraItem());
        map.put("scanTime", event.getScanTime());
        map.put("timeSincePreviousMs", event.getTimeSincePreviousMs());
        map.put("workerColor", event.getWorkerColor());
        switch (event.getEventType()) {
            case SCAN -> {
                map.put("outcome", "ACCEPTED");
                map.put("message", "Accepted into box " + event.getBoxNumber());
            }
            case EXTRA_ITEM -> {
                map.put("outcome", "EXTRA_ITEM");
                map.put("message", "Extra item: " + event.getProductName() + " is not needed in any box");
            }
            case ERROR -> {
                map.put("outcome", "ERROR");
                map.put("message", "System error: job has no box requirements");
            }
            case UNDO -> {
                map.put("outcome", "UNDONE");
                map.put("message", "Removed from box " + event.getBoxNumber());
            }
        }
        return map;
    }

    public record ScanRequest(@NotNull Long sessionId, @NotBlank String barCode) {
    }

    public record UndoRequest(@NotNull Long sessionId, @Min(1) Integer count) {
    }
}
