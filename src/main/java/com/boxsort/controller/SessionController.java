package com.boxsort.controller;

import com.boxsort.model.ScanSession;
import com.boxsort.model.SessionStatus;
import com.boxsort.service.SessionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    @Autowired
    private SessionService sessionService;

    @PostMapping
    public ResponseEntity<ScanSession> startSession(@Valid @RequestBody StartSessionRequest request) {
        return ResponseEntity.ok(sessionService.startSession(request.jobId(), request.workerId()));
    }

    @GetMapping("/active")
    public ResponseEntity<ScanSession> activeSession(@RequestParam String workerId) {
        return sessionService.getActiveSession(workerId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ScanSession> getSession(@PathVariable Long id) {
        return ResponseEntity.ok(sessionService.getSession(id));
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<ScanSession> updateStatus(@PathVariable Long id,
                                                    @Valid @RequestBody StatusRequest request) {
        return ResponseEntity.ok(sessionService.updateStatus(id, request.status()));
    }

    public record StartSessionRequest(@NotBlank String jobId, @NotBlank String workerId) {
    }

    public record StatusRequest(@NotNull SessionStatus status) {
    }
}
