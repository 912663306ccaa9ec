package com.koni.tracking.infrastructure.persistence.repository;

import com.koni.tracking.domain.model.RssiWeightBand;
import com.koni.tracking.domain.repository.RssiWeightRepository;
import com.koni.tracking.domain.store.DataStoreSession;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class JdbcRssiWeightRepositoryAdapter implements RssiWeightRepository {

    private static final String FIND_ALL =
            "SELECT bottom_rssi, upper_rssi, weight FROM rssi_weight_table ORDER BY bottom_rssi ASC";

    @Override
    public List<RssiWeightBand> findAll(DataStoreSession session) {
        return session.query(FIND_ALL, (row, rowNum) -> new RssiWeightBand(
                row.getInt("bottom_rssi"),
                row.getInt("upper_rssi"),
                row.getInt("weight")));
    }
}
