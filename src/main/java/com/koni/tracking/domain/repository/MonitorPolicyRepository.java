package com.koni.tracking.domain.repository;

import com.koni.tracking.domain.model.MonitorPolicy;
import com.koni.tracking.domain.model.PolicyTable;
import com.koni.tracking.domain.store.DataStoreSession;

import java.util.List;

/**
 * Repository interface for time-windowed monitor policies.
 */
public interface MonitorPolicyRepository {
    
    List<MonitorPolicy> findAll(DataStoreSession session, PolicyTable table);
    
    void updateActive(DataStoreSession session, PolicyTable table, long policyId, boolean active);
}
