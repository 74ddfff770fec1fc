package com.chess.analytics.service;

import com.chess.analytics.config.AnalyticsProperties;
import com.chess.analytics.dto.ConsistencyReport;
import com.chess.analytics.dto.OpeningMismatch;
import com.chess.analytics.model.readonly.OpeningDocument;
import com.mongodb.ClientSessionOptions;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.SessionCallback;
import org.springframework.data.mongodb.core.SessionScoped;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OpeningConsistencyServiceTest {

    @Mock
    private MongoTemplate mongoTemplate;

    @Mock
    private SessionScoped snapshotSession;

    private OpeningConsistencyService service;

    @BeforeEach
    void setUp() {
        service = new OpeningConsistencyService(mongoTemplate, new QueryBudget(new AnalyticsProperties()));
        when(mongoTemplate.withSession(any(ClientSessionOptions.class))).thenReturn(snapshotSession);
        when(snapshotSession.execute(any(), any())).thenAnswer(invocation -> {
            SessionCallback<?> callback = invocation.getArgument(0);
            return callback.doInSession(mongoTemplate);
        });
    }

    private static OpeningDocument opening(String eco, long whiteWins, long blackWins, long draws) {
        OpeningDocument opening = new OpeningDocument();
        ReflectionTestUtils.setField(opening, "id", eco);
        ReflectionTestUtils.setField(opening, "ecoCode", eco);
        ReflectionTestUtils.setField(opening, "whiteWins", whiteWins);
        ReflectionTestUtils.setField(opening, "blackWins", blackWins);
        ReflectionTestUtils.setField(opening, "draws", draws);
        ReflectionTestUtils.setField(opening, "totalGames", whiteWins + blackWins + draws);
        return opening;
    }

    private void storedOpenings(OpeningDocument... openings) {
        when(mongoTemplate.find(any(Query.class), eq(OpeningDocument.class))).thenReturn(List.of(openings));
    }

    private static Document counters(String eco, int whiteWins, int blackWins, int draws) {
        return new Document("_id", eco)
                .append("totalGames", whiteWins + blackWins + draws)
                .append("whiteWins", whiteWins)
                .append("blackWins", blackWins)
                .append("draws", draws);
    }

    private void gamesAggregateTo(Document... documents) {
        when(mongoTemplate.aggregate(any(Aggregation.class), eq("games"), eq(Document.class)))
                .thenReturn(new AggregationResults<>(List.of(documents), new Document()));
    }

    @Test
    void matchingCountersAreConsistent() {
        gamesAggregateTo(counters("C50", 3, 1, 1), counters("B01", 1, 1, 0));
        storedOpenings(opening("C50", 3, 1, 1), opening("B01", 1, 1, 0));

        ConsistencyReport report = service.check(QueryFilters.none());

        assertThat(report.consistent()).isTrue();
        assertThat(report.openingsChecked()).isEqualTo(2);
        assertThat(report.mismatches()).isEmpty();
    }

    @Test
    void everyDifferingOpeningIsReportedInCodeOrder() {
        gamesAggregateTo(counters("C50", 3, 1, 1), counters("B01", 1, 1, 0));
        storedOpenings(opening("C50", 3, 1, 1), opening("B01", 1, 0, 0), opening("A00", 1, 0, 0));

        ConsistencyReport report = service.check(QueryFilters.none());

        assertThat(report.consistent()).isFalse();
        assertThat(report.openingsChecked()).isEqualTo(3);
        assertThat(report.mismatches()).extracting(OpeningMismatch::ecoCode).containsExactly("A00", "B01");
        assertThat(report.mismatches().get(0)).isEqualTo(new OpeningMismatch("A00", 1, 1, 0, 0, 0, 0, 0, 0));
        assertThat(report.mismatches().get(1)).isEqualTo(new OpeningMismatch("B01", 1, 1, 0, 0, 2, 1, 1, 0));
    }

    @Test
    void storedCountersAreReadBeforeTheGamesInOneSnapshot() {
        gamesAggregateTo(counters("C50", 3, 1, 1));
        storedOpenings(opening("C50", 3, 1, 1));

        service.check(QueryFilters.none());

        ArgumentCaptor<ClientSessionOptions> options = ArgumentCaptor.forClass(ClientSessionOptions.class);
        verify(mongoTemplate).withSession(options.capture());
        assertThat(options.getValue().isSnapshot()).isTrue();
        InOrder reads = inOrder(mongoTemplate);
        reads.verify(mongoTemplate).find(any(Query.class), eq(OpeningDocument.class));
        reads.verify(mongoTemplate).aggregate(any(Aggregation.class), eq("games"), eq(Document.class));
    }
}
