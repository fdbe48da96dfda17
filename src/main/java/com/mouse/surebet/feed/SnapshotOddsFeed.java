package com.mouse.surebet.feed;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.surebet.config.SurebetProperties;
import com.mouse.surebet.enums.SportType;
import com.mouse.surebet.exception.TransientFetchException;
import com.mouse.surebet.model.OddsQuery;
import com.mouse.surebet.model.OddsRow;
import com.mouse.surebet.model.snapshot.OddsSnapshotDocument;
import com.mouse.surebet.model.snapshot.SnapshotMatch;
import com.mouse.surebet.model.snapshot.SnapshotOdds;
import com.mouse.surebet.utils.FeedTimestamps;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Prefers the published odds.json snapshot and falls back to the database view when the snapshot is
 * unreachable or fails validation. Snapshot matches are flattened back into rows so both paths go
 * through the same aggregation.
 */
@Slf4j
@Primary
@Component
public class SnapshotOddsFeed implements OddsFeed {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final SurebetProperties properties;
    private final SnapshotValidator validator;
    private final DatabaseOddsFeed fallback;
    private final Clock clock;

    public SnapshotOddsFeed(OkHttpClient httpClient, ObjectMapper objectMapper, SurebetProperties properties,
                            SnapshotValidator validator, DatabaseOddsFeed fallback, Clock clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.validator = validator;
        this.fallback = fallback;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "snapshot";
    }

    @Override
    public List<OddsRow> fetch(OddsQuery query) {
        if (!properties.getSnapshot().isEnabled()) {
            return fallback.fetch(query);
        }

        Optional<OddsSnapshotDocument> document = download();
        if (document.isEmpty()) {
            return fallback.fetch(query);
        }

        List<String> problems = validator.validate(document.get());
        if (!problems.isEmpty()) {
            log.warn("⚠️ Snapshot rejected, reading database instead | {} problem(s), first: {}",
                    problems.size(), problems.get(0));
            return fallback.fetch(query);
        }

        List<OddsRow> rows = flatten(document.get(), query);
        log.debug("Snapshot generated_at={} gave {} rows", document.get().getGeneratedAt(), rows.size());
        return rows;
    }

    private Optional<OddsSnapshotDocument> download() {
        HttpUrl base = HttpUrl.parse(properties.getSnapshot().getUrl());
        if (base == null) {
            log.warn("⚠️ Snapshot url '{}' is not a valid http(s) url", properties.getSnapshot().getUrl());
            return Optional.empty();
        }
        HttpUrl url = base.newBuilder()
                .addQueryParameter("v", String.valueOf(clock.millis()))
                .build();

        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                log.warn("⚠️ Snapshot fetch returned HTTP {}", response.code());
                return Optional.empty();
            }
            return Optional.ofNullable(objectMapper.readValue(body.byteStream(), OddsSnapshotDocument.class));
        } catch (InterruptedIOException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new TransientFetchException("Snapshot fetch interrupted", e);
            }
            log.warn("⚠️ Snapshot fetch timed out: {}", e.getMessage());
            return Optional.empty();
        } catch (IOException e) {
            log.warn("⚠️ Snapshot fetch failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private List<OddsRow> flatten(OddsSnapshotDocument document, OddsQuery query) {
        List<OddsRow> rows = new ArrayList<>();
        for (SnapshotMatch match : document.getMatches()) {
            Optional<SportType> sport = SportType.fromName(match.getSportType());
            if (sport.isEmpty()) {
                log.debug("Skipping match {} with unknown sport '{}'", match.getMatchId(), match.getSportType());
                continue;
            }
            Instant matchDate = FeedTimestamps.parse(match.getMatchDate());
            for (SnapshotOdds odds : match.getOdds()) {
                if (odds == null) {
                    continue;
                }
                OddsRow row = OddsRow.builder()
                        .matchId(match.getMatchId())
                        .matchDate(matchDate)
                        .matchStatus(match.getMatchStatus())
                        .leagueName(match.getLeagueName())
                        .leagueCountry(match.getLeagueCountry())
                        .sportType(sport.get())
                        .homeTeam(match.getHomeTeam())
                        .awayTeam(match.getAwayTeam())
                        .bookmakerId(odds.getBookmakerId())
                        .bookmakerName(odds.getBookmakerName())
                        .homeOdd(odds.getHomeOdd())
                        .drawOdd(odds.getDrawOdd())
                        .awayOdd(odds.getAwayOdd())
                        .marginPercentage(odds.getMarginPercentage())
                        .dataAgeSeconds(odds.getDataAgeSeconds() != null ? odds.getDataAgeSeconds().longValue() : null)
                        .scrapedAt(FeedTimestamps.parse(odds.getScrapedAt()))
                        .extraData(odds.getExtraData())
                        .oddsType(odds.getOddsType())
                        .build();
                if (query.matches(row)) {
                    rows.add(row);
                }
            }
        }
        return rows;
    }
}
