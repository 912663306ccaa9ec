package com.koni.tracking.application.query;

import com.koni.tracking.domain.model.TagSummary;
import com.koni.tracking.domain.repository.TagSummaryRepository;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionLease;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Query handler for the tag summaries, the read model of tracking.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetTagSummariesQueryHandler {

    private final ConnectionPool connectionPool;
    private final TagSummaryRepository tagSummaryRepository;

    /**
     * @param query the query object (contains no parameters)
     * @return one response per tag, or an empty list if no tag is tracked
     */
    public List<TagSummaryResponse> handle(GetTagSummariesQuery query) {
        log.debug("Handling GetTagSummariesQuery");

        List<TagSummaryResponse> tags;
        try (ConnectionLease lease = connectionPool.acquire()) {
            tags = tagSummaryRepository.findAll(lease.session()).stream()
                    .map(this::toResponse)
                    .collect(Collectors.toList());
        }

        log.info("Retrieved {} tag summaries", tags.size());
        return tags;
    }

    private TagSummaryResponse toResponse(TagSummary summary) {
        return new TagSummaryResponse(
                summary.getMac(),
                summary.getUuid(),
                summary.getRssi(),
                summary.getFirstSeen(),
                summary.getLastSeen(),
                summary.getBatteryVoltage(),
                summary.getAnchorX(),
                summary.getAnchorY(),
                summary.getGeofenceViolationTimestamp(),
                summary.getPanicViolationTimestamp(),
                summary.getMovementViolationTimestamp(),
                summary.getLocationViolationTimestamp()
        );
    }
}
