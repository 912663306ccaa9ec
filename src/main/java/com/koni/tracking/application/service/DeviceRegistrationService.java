package com.koni.tracking.application.service;

import com.koni.tracking.domain.model.BeaconCoordinates;
import com.koni.tracking.domain.model.BeaconHealthReport;
import com.koni.tracking.domain.model.BeaconRecord;
import com.koni.tracking.domain.model.GatewayRecord;
import com.koni.tracking.domain.model.HealthStatus;
import com.koni.tracking.domain.repository.DeviceRepository;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionLease;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Upserts gateway and beacon identity and health from registration and heartbeat messages.
 * Each message is handled on one connection; the first failure aborts the rest of the message.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeviceRegistrationService {

    private final ConnectionPool connectionPool;
    private final DeviceRepository deviceRepository;

    public void registerGateways(List<String> gatewayAddresses) {
        try (ConnectionLease lease = connectionPool.acquire()) {
            for (String address : gatewayAddresses) {
                deviceRepository.upsertGateway(lease.session(), new GatewayRecord(address, HealthStatus.NORMAL));
                log.debug("Gateway registered: ip={}", address);
            }
        }
        log.info("Registered {} gateways", gatewayAddresses.size());
    }

    public void registerBeacons(List<BeaconRecord> beacons) {
        try (ConnectionLease lease = connectionPool.acquire()) {
            for (BeaconRecord beacon : beacons) {
                deviceRepository.upsertBeacon(lease.session(), beacon);
                log.debug("Beacon registered: uuid={}, ip={}, gateway={}",
                        beacon.getUuid(), beacon.getIpAddress(), beacon.getGatewayIpAddress());
            }
        }
        log.info("Registered {} beacons", beacons.size());
    }

    public void updateGatewayHealth(GatewayRecord gateway) {
        try (ConnectionLease lease = connectionPool.acquire()) {
            deviceRepository.upsertGateway(lease.session(), gateway);
        }
        log.debug("Gateway health updated: ip={}, status={}", gateway.getIpAddress(), gateway.getHealthStatus());
    }

    /**
     * Records a beacon heartbeat. A beacon seen for the first time is created with
     * the coordinates encoded in its uuid.
     *
     * @param report the parsed heartbeat
     * @param gatewayAddress the gateway the heartbeat arrived through
     */
    public void updateBeaconHealth(BeaconHealthReport report, String gatewayAddress) {
        BeaconRecord beacon = new BeaconRecord(
                report.getUuid(),
                report.getIpAddress(),
                gatewayAddress,
                report.getHealthStatus(),
                Instant.ofEpochSecond(report.getBeaconTimestamp()),
                BeaconCoordinates.fromUuid(report.getUuid())
        );

        try (ConnectionLease lease = connectionPool.acquire()) {
            deviceRepository.upsertBeaconHealth(lease.session(), beacon);
        }
        log.debug("Beacon health updated: uuid={}, status={}", report.getUuid(), report.getHealthStatus());
    }
}
