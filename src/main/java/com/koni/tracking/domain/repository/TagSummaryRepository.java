package com.koni.tracking.domain.repository;

import com.koni.tracking.domain.model.AnchorUpdate;
import com.koni.tracking.domain.model.MonitorType;
import com.koni.tracking.domain.model.MonitoredTag;
import com.koni.tracking.domain.model.MovingTagUpdate;
import com.koni.tracking.domain.model.StableTagUpdate;
import com.koni.tracking.domain.model.TagPlacement;
import com.koni.tracking.domain.model.TagSummary;
import com.koni.tracking.domain.model.ViolationCandidate;
import com.koni.tracking.domain.store.DataStoreSession;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for the per-tag summary rows.
 * The summary is the read model of tracking: one mutable row per tag holding its
 * current beacon, signal, anchor location and last violation timestamps.
 */
public interface TagSummaryRepository {
    
    /**
     * Retrieves every tag summary.
     * 
     * @param session the borrowed session
     * @return all summaries, empty if none exist
     */
    List<TagSummary> findAll(DataStoreSession session);
    
    /**
     * Clears the location-updated flag of every tag at the start of a summarization cycle.
     * 
     * @return the number of rows reset
     */
    int resetLocationUpdated(DataStoreSession session);
    
    void applyStable(DataStoreSession session, StableTagUpdate update);
    
    void applyMoving(DataStoreSession session, MovingTagUpdate update);
    
    void applyAnchor(DataStoreSession session, AnchorUpdate update);
    
    /**
     * Stamps the panic violation timestamp, but only if the tag's object is monitored for panic.
     * 
     * @param session the borrowed session
     * @param mac the tag mac address
     * @param at the violation time
     * @return true if a summary row was stamped
     */
    boolean stampPanicIfMonitored(DataStoreSession session, String mac, Instant at);
    
    /**
     * Stamps the violation timestamp of one monitor type.
     * 
     * @param session the borrowed session
     * @param monitorType selects the violation timestamp column
     * @param mac the tag mac address
     * @param at the violation time
     * @return the number of rows stamped
     */
    int stampViolation(DataStoreSession session, MonitorType monitorType, String mac, Instant at);
    
    /**
     * Finds summaries whose violation timestamp of the given type is at or after {@code since}.
     */
    List<ViolationCandidate> findViolationsSince(DataStoreSession session, MonitorType monitorType, Instant since);
    
    /**
     * Finds tags monitored for location whose area has an active not-stay-room policy.
     */
    List<TagPlacement> findUnderActiveRoomPolicy(DataStoreSession session);
    
    /**
     * Finds tags monitored for location whose area has an active long-stay-in-danger policy.
     */
    List<TagPlacement> findUnderActiveDangerPolicy(DataStoreSession session);
    
    /**
     * Finds tags monitored for movement whose area has an active movement policy, ordered by mac.
     */
    List<MonitoredTag> findUnderActiveMovementPolicy(DataStoreSession session);
}
