package com.mouse.surebet.controller;

import com.mouse.surebet.event.OddsRowsChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Entry point for the store's "new rows available" push channel.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/feeds")
public class FeedWebhookController {

    private final ApplicationEventPublisher eventPublisher;

    @PostMapping("/{feedId}/changed")
    public ResponseEntity<Map<String, Object>> rowsChanged(@PathVariable String feedId) {
        log.debug("POST /api/v1/feeds/{}/changed", feedId);
        eventPublisher.publishEvent(new OddsRowsChangedEvent(feedId, Instant.now()));
        return ResponseEntity.accepted().body(Map.of("feedId", feedId, "accepted", true));
    }
}
