package com.chess.analytics.controller;

import com.chess.analytics.repository.readonly.GameReadRepository;
import com.chess.analytics.service.AnalyticsService;
import com.chess.analytics.service.QueryFilters;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock
    private GameReadRepository gameRepository;

    @Mock
    private AnalyticsService analyticsService;

    @InjectMocks
    private HealthController controller;

    @Test
    void statusPassesTheTimeout() {
        controller.status(1500L);

        verify(analyticsService).databaseStatus(new QueryFilters(null, null, Duration.ofMillis(1500)));
    }

    @Test
    void statusWithoutTimeoutUsesTheDefault() {
        controller.status(null);

        verify(analyticsService).databaseStatus(QueryFilters.none());
    }

    @Test
    void unreachableDatabaseIsDegraded() {
        when(gameRepository.count()).thenThrow(new DataAccessResourceFailureException("no server"));

        Map<String, Object> health = controller.health();

        assertThat(health).containsEntry("status", "DEGRADED");
    }
}
