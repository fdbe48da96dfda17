package com.mouse.surebet.feed;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.surebet.config.HttpClientConfig;
import com.mouse.surebet.config.SurebetProperties;
import com.mouse.surebet.enums.SportType;
import com.mouse.surebet.exception.TransientFetchException;
import com.mouse.surebet.model.OddsQuery;
import com.mouse.surebet.model.OddsRow;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.mouse.surebet.OddsFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SnapshotOddsFeedTest {

    @Mock
    DatabaseOddsFeed databaseFeed;

    MockWebServer server;
    SurebetProperties properties;
    SnapshotOddsFeed feed;
    String snapshotJson;

    static final OddsQuery FOOTBALL = OddsQuery.builder().sportType(SportType.FOOTBALL).build();

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        try (InputStream in = getClass().getResourceAsStream("/snapshot/odds.json")) {
            snapshotJson = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        properties = new SurebetProperties();
        properties.getSnapshot().setUrl(server.url("/data/odds.json").toString());
        feed = new SnapshotOddsFeed(
                new HttpClientConfig().surebetHttpClient(properties),
                new ObjectMapper(),
                properties,
                new SnapshotValidator(),
                databaseFeed,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void fetch_validSnapshot_flattensMatchingRowsWithCacheBusting() throws Exception {
        server.enqueue(new MockResponse().setBody(snapshotJson).addHeader("Content-Type", "application/json"));

        List<OddsRow> rows = feed.fetch(FOOTBALL);

        assertThat(rows).hasSize(3);
        assertThat(rows).extracting(OddsRow::getBookmakerName).containsExactly("BookA", "BookB", "BookC");
        OddsRow first = rows.get(0);
        assertThat(first.getMatchDate()).isEqualTo(Instant.parse("2025-01-10T20:00:00Z"));
        assertThat(first.getScrapedAt()).isEqualTo(Instant.parse("2025-01-10T17:59:00Z"));
        assertThat(first.getDataAgeSeconds()).isEqualTo(60L);
        assertThat(first.getSportType()).isEqualTo(SportType.FOOTBALL);
        assertThat(first.getExtraData()).containsEntry("event_id", "111");
        verifyNoInteractions(databaseFeed);

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getPath()).isEqualTo("/data/odds.json?v=" + NOW.toEpochMilli());
        assertThat(request.getHeader("Cache-Control")).isEqualTo("no-cache");
    }

    @Test
    void fetch_basketballQuery_keepsOnlyBasketballMatches() {
        server.enqueue(new MockResponse().setBody(snapshotJson));

        List<OddsRow> rows = feed.fetch(OddsQuery.builder().sportType(SportType.BASKETBALL).build());

        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row.getMatchId()).isEqualTo("B-1");
            assertThat(row.getDrawOdd()).isNull();
        });
    }

    @Test
    void fetch_serverError_fallsBackToDatabase() {
        server.enqueue(new MockResponse().setResponseCode(503));
        List<OddsRow> dbRows = List.of(football("M-9", "BookA", "2.00", "3.00", "4.00"));
        when(databaseFeed.fetch(FOOTBALL)).thenReturn(dbRows);

        assertThat(feed.fetch(FOOTBALL)).isEqualTo(dbRows);
    }

    @Test
    void fetch_inconsistentSnapshot_fallsBackToDatabase() {
        server.enqueue(new MockResponse().setBody(snapshotJson.replace("\"matches_count\": 2", "\"matches_count\": 7")));
        when(databaseFeed.fetch(FOOTBALL)).thenReturn(List.of());

        assertThat(feed.fetch(FOOTBALL)).isEmpty();
        verify(databaseFeed).fetch(FOOTBALL);
    }

    @Test
    void fetch_unparsableBody_fallsBackToDatabase() {
        server.enqueue(new MockResponse().setBody("<html>maintenance</html>"));
        when(databaseFeed.fetch(FOOTBALL)).thenReturn(List.of());

        feed.fetch(FOOTBALL);

        verify(databaseFeed).fetch(FOOTBALL);
    }

    @Test
    void fetch_snapshotDisabled_readsDatabaseWithoutHttpCall() {
        properties.getSnapshot().setUrl("");
        when(databaseFeed.fetch(FOOTBALL)).thenReturn(List.of());

        feed.fetch(FOOTBALL);

        verify(databaseFeed).fetch(FOOTBALL);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void fetch_bothSourcesDown_propagatesTransientFailure() {
        server.enqueue(new MockResponse().setResponseCode(500));
        when(databaseFeed.fetch(any())).thenThrow(new TransientFetchException("db down"));

        assertThatThrownBy(() -> feed.fetch(FOOTBALL)).isInstanceOf(TransientFetchException.class);
    }
}
