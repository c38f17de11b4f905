package com.example.contextsync.controller;

import com.example.contextsync.model.ContextSnapshot;
import com.example.contextsync.session.SessionRegistry;
import com.example.contextsync.store.ContextStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class StatusController {

    private final ContextStore contextStore;
    private final SessionRegistry sessionRegistry;

    public StatusController(ContextStore contextStore, SessionRegistry sessionRegistry) {
        this.contextStore = contextStore;
        this.sessionRegistry = sessionRegistry;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "context-sync-server");
        health.put("version", "1.0.0");
        return ResponseEntity.ok(health);
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        ContextSnapshot snapshot = contextStore.get();
        Map<String, Object> status = new HashMap<>();
        status.put("connected_clients", sessionRegistry.size());
        status.put("context_entries", snapshot.getEntryCount());
        status.put("total_tokens", snapshot.getTotalTokens());
        status.put("max_tokens", snapshot.getMaxTokens());
        status.put("version", snapshot.getVersion());
        status.put("authenticated_clients", sessionRegistry.describe());
        status.put("idle_timeout_seconds", sessionRegistry.getIdleTimeout().toSeconds());
        return ResponseEntity.ok(status);
    }
}
