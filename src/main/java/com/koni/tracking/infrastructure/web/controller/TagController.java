package com.koni.tracking.infrastructure.web.controller;

import com.koni.tracking.application.query.GetTagSummariesQuery;
import com.koni.tracking.application.query.GetTagSummariesQueryHandler;
import com.koni.tracking.application.query.TagSummaryResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for tag summary queries (read path).
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class TagController {

    private final GetTagSummariesQueryHandler queryHandler;

    /**
     * Retrieves every tag with its current beacon, signal, anchor location and
     * last violation timestamps.
     * 
     * @return 200 OK with the summaries (empty list if no tag has reported yet)
     */
    @GetMapping("/v1/tags")
    public ResponseEntity<List<TagSummaryResponse>> getTags() {
        log.info("Received request to get all tag summaries");

        List<TagSummaryResponse> tags = queryHandler.handle(new GetTagSummariesQuery());

        log.info("Returning {} tag summaries", tags.size());
        return ResponseEntity.ok(tags);
    }
}
