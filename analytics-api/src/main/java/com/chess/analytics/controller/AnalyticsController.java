package com.chess.analytics.controller;

import com.chess.analytics.dto.ConsistencyReport;
import com.chess.analytics.dto.OpeningStats;
import com.chess.analytics.dto.PlayerReport;
import com.chess.analytics.dto.RatingTrend;
import com.chess.analytics.dto.RepertoireEntry;
import com.chess.analytics.dto.TimeControlStats;
import com.chess.analytics.dto.VolatilityEntry;
import com.chess.analytics.model.Color;
import com.chess.analytics.model.TimeControlClass;
import com.chess.analytics.service.AnalyticsService;
import com.chess.analytics.service.OpeningConsistencyService;
import com.chess.analytics.service.QueryFilters;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/api/analytics")
@Tag(name = "Analytics", description = "Aggregated statistics over imported games")
public class AnalyticsController {

    private final AnalyticsService analyticsService;
    private final OpeningConsistencyService consistencyService;

    public AnalyticsController(
            AnalyticsService analyticsService,
            OpeningConsistencyService consistencyService
    ) {
        this.analyticsService = analyticsService;
        this.consistencyService = consistencyService;
    }

    // ============ OPENINGS ============

    @GetMapping("/openings")
    @Operation(summary = "Opening success rates",
               description = "White/black win and draw rates per ECO code, most played first")
    public List<OpeningStats> openings(
            @Parameter(description = "Only openings with at least this many games")
            @RequestParam(required = false) Integer minGames,
            @Parameter(description = "bullet, blitz, rapid, classical or unknown")
            @RequestParam(required = false) String timeControl,
            @Parameter(description = "Maximum number of openings (default 50)")
            @RequestParam(required = false) Integer limit,
            @Parameter(description = "Query time budget in milliseconds")
            @RequestParam(required = false) Long timeoutMs
    ) {
        return analyticsService.openingSuccessRates(filters(minGames, timeControl, timeoutMs), limit);
    }

    @GetMapping("/consistency")
    @Operation(summary = "Opening counter consistency",
               description = "Recompute opening counters from games and list every opening whose stored counters differ")
    public ConsistencyReport consistency(
            @Parameter(description = "Query time budget in milliseconds")
            @RequestParam(required = false) Long timeoutMs
    ) {
        return consistencyService.check(filters(null, null, timeoutMs));
    }

    // ============ TIME CONTROLS ============

    @GetMapping("/time-controls")
    @Operation(summary = "Time-control comparison",
               description = "Games, average rating and result rates per time-control class")
    public List<TimeControlStats> timeControls(
            @RequestParam(required = false) Integer minGames,
            @RequestParam(required = false) String timeControl,
            @RequestParam(required = false) Long timeoutMs
    ) {
        return analyticsService.timeControlComparison(filters(minGames, timeControl, timeoutMs));
    }

    // ============ PLAYERS ============

    @GetMapping("/players/{name}")
    @Operation(summary = "Player report", description = "Profile, recent rating trend, white repertoire and recent games")
    public PlayerReport player(
            @PathVariable String name,
            @Parameter(description = "Time budget in milliseconds shared by all parts of the report")
            @RequestParam(required = false) Long timeoutMs
    ) {
        return analyticsService.playerReport(name, filters(null, null, timeoutMs));
    }

    @GetMapping("/players/{name}/rating-trend")
    @Operation(summary = "Rating trend", description = "Rating history of a player, oldest first")
    public RatingTrend ratingTrend(
            @PathVariable String name,
            @Parameter(description = "Only the most recent N points")
            @RequestParam(required = false) Integer last,
            @RequestParam(required = false) String timeControl,
            @RequestParam(required = false) Long timeoutMs
    ) {
        return analyticsService.ratingTrend(name, filters(null, timeControl, timeoutMs), last);
    }

    @GetMapping("/players/{name}/repertoire")
    @Operation(summary = "Opening repertoire", description = "Openings played with one color, most played first")
    public List<RepertoireEntry> repertoire(
            @PathVariable String name,
            @Parameter(description = "white or black")
            @RequestParam(defaultValue = "white") String color,
            @RequestParam(required = false) Integer minGames,
            @RequestParam(required = false) String timeControl,
            @RequestParam(required = false) Long timeoutMs
    ) {
        return analyticsService.repertoire(name, Color.fromName(color), filters(minGames, timeControl, timeoutMs));
    }

    @GetMapping("/volatility")
    @Operation(summary = "Rating volatility",
               description = "Standard deviation of successive rating changes per player, most volatile first")
    public List<VolatilityEntry> volatility(
            @Parameter(description = "Only players with at least this many rating points")
            @RequestParam(required = false) Integer minGames,
            @RequestParam(required = false) String timeControl,
            @Parameter(description = "Maximum number of players (default 100)")
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long timeoutMs
    ) {
        return analyticsService.volatility(filters(minGames, timeControl, timeoutMs), limit);
    }

    private static QueryFilters filters(Integer minGames, String timeControl, Long timeoutMs) {
        TimeControlClass timeControlClass = timeControl == null || timeControl.isBlank()
                ? null
                : TimeControlClass.fromName(timeControl);
        Duration timeout = timeoutMs != null ? Duration.ofMillis(timeoutMs) : null;
        return new QueryFilters(minGames, timeControlClass, timeout);
    }
}
