package com.chess.analytics.controller;

import com.chess.analytics.dto.DatabaseStatus;
import com.chess.analytics.repository.readonly.GameReadRepository;
import com.chess.analytics.service.AnalyticsService;
import com.chess.analytics.service.QueryFilters;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Health", description = "API health and status")
public class HealthController {

    private final GameReadRepository gameRepository;
    private final AnalyticsService analyticsService;

    public HealthController(
            GameReadRepository gameRepository,
            AnalyticsService analyticsService
    ) {
        this.gameRepository = gameRepository;
        this.analyticsService = analyticsService;
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check API and database connectivity")
    public Map<String, Object> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("timestamp", Instant.now());

        // Reads only; the ingest service owns all writes
        try {
            long gameCount = gameRepository.count();
            health.put("dataAccess", "OK");
            health.put("gameCount", gameCount);
        } catch (RuntimeException e) {
            health.put("status", "DEGRADED");
            health.put("dataAccess", "ERROR: " + e.getMessage());
        }

        return health;
    }

    @GetMapping("/status")
    @Operation(summary = "Database status", description = "Collection counts and the most recent import runs")
    public DatabaseStatus status(
            @Parameter(description = "Time budget in milliseconds shared by all counts")
            @RequestParam(required = false) Long timeoutMs
    ) {
        return analyticsService.databaseStatus(QueryFilters.budgetOnly(timeoutMs));
    }
}
