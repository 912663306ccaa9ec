package com.koni.tracking.domain.repository;

import com.koni.tracking.domain.model.RssiWeightBand;
import com.koni.tracking.domain.store.DataStoreSession;

import java.util.List;

/**
 * Repository interface for the configured RSSI-to-weight table.
 */
public interface RssiWeightRepository {
    
    /**
     * @return the weight bands ordered by bottom RSSI ascending
     */
    List<RssiWeightBand> findAll(DataStoreSession session);
}
