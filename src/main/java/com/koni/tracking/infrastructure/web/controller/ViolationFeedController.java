package com.koni.tracking.infrastructure.web.controller;

import com.koni.tracking.application.service.ViolationFeedService;
import com.koni.tracking.infrastructure.config.TrackingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the violation feed consumed by the upstream notifier.
 * 
 * Endpoints:
 * - GET /api/v1/violations/feed?capacity=N: Drain pending violation events
 * 
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ViolationFeedController {

    private final ViolationFeedService violationFeedService;
    private final TrackingProperties properties;

    /**
     * Drains pending events. Each event is returned by exactly one call; an empty body
     * means nothing is pending.
     * 
     * Example response:
     * 7,1,AA:BB:CC:DD:EE:01,00010018000000003460000000000011,2024-01-01 10:00:00;8,4,...
     * 
     * @param capacity maximum response length in characters, defaults to the configured feed capacity
     * @return 200 OK with the concatenated event records
     */
    @GetMapping(value = "/v1/violations/feed", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> drainFeed(@RequestParam(value = "capacity", required = false) Integer capacity) {
        int limit = capacity != null ? capacity : properties.getViolation().getDefaultFeedCapacity();
        String feed = violationFeedService.drain(limit);
        log.debug("Returning violation feed of {} chars", feed.length());
        return ResponseEntity.ok(feed);
    }
}
