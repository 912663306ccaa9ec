package com.koni.tracking.infrastructure.protocol;

import com.koni.tracking.domain.exception.ProtocolFormatException;
import com.koni.tracking.domain.model.BeaconCoordinates;
import com.koni.tracking.domain.model.BeaconHealthReport;
import com.koni.tracking.domain.model.BeaconRecord;
import com.koni.tracking.domain.model.GatewayRecord;
import com.koni.tracking.domain.model.HealthStatus;
import com.koni.tracking.domain.model.TrackingReport;
import com.koni.tracking.domain.model.TrackingSample;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes the {@code ;}-separated wire records sent by gateways.
 * 
 * A record is parsed completely before anything is returned; any missing or
 * malformed field fails the whole record with a {@link ProtocolFormatException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WireMessageParser {

    /**
     * Tracking reports carry one sample group per object type: BR/EDR, then BLE.
     */
    static final int OBJECT_TYPE_GROUPS = 2;

    private final Clock clock;

    /**
     * Parses {@code uuid;lbeacon_ts;lbeacon_ip;(type;count;samples)x2}.
     * The latency of every sample is the receive time minus the beacon timestamp, in seconds.
     */
    public TrackingReport parseTrackingReport(String record) {
        FieldCursor cursor = new FieldCursor(record);
        String beaconUuid = cursor.next("lbeacon_uuid");
        long beaconTimestamp = cursor.nextEpochSecond("lbeacon_timestamp").getEpochSecond();
        String beaconIp = cursor.next("lbeacon_ip");
        long latency = clock.instant().getEpochSecond() - beaconTimestamp;

        List<TrackingSample> samples = new ArrayList<>();
        for (int group = 0; group < OBJECT_TYPE_GROUPS; group++) {
            cursor.next("object_type");
            samples.addAll(readSamples(cursor, beaconUuid, latency));
        }

        log.debug("Parsed tracking report: beacon={}, samples={}, latency={}s", beaconUuid, samples.size(), latency);
        return new TrackingReport(beaconUuid, beaconTimestamp, beaconIp, samples);
    }

    /**
     * Parses one sample group {@code count;(mac;init_ts;final_ts;rssi;panic;battery)*count}.
     *
     * @param record the group record
     * @param beaconUuid the beacon that observed the tags
     * @param latency seconds between the beacon's report time and its reception
     * @return the samples in wire order
     */
    public List<TrackingSample> parseSampleGroup(String record, String beaconUuid, long latency) {
        return readSamples(new FieldCursor(record), beaconUuid, latency);
    }

    /**
     * Parses {@code count;ip+}. The count must be positive.
     */
    public List<String> parseGatewayRegistration(String record) {
        FieldCursor cursor = new FieldCursor(record);
        int count = requirePositive(cursor.nextCount("gateway_count"), "gateway_count");

        List<String> addresses = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            addresses.add(cursor.next("gateway_ip"));
        }
        return addresses;
    }

    /**
     * Parses {@code count;not_used_gateway_ip;(uuid;init_ts;lbeacon_ip)*count}.
     * The gateway address recorded for each beacon is the packet's source address.
     */
    public List<BeaconRecord> parseBeaconRegistration(String record, String gatewayAddress) {
        FieldCursor cursor = new FieldCursor(record);
        int count = requirePositive(cursor.nextCount("lbeacon_count"), "lbeacon_count");
        cursor.next("gateway_ip");

        List<BeaconRecord> beacons = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String uuid = cursor.next("lbeacon_uuid");
            Instant registeredAt = cursor.nextEpochSecond("registered_timestamp");
            String ipAddress = cursor.next("lbeacon_ip");
            beacons.add(new BeaconRecord(
                    uuid,
                    ipAddress,
                    gatewayAddress,
                    HealthStatus.NORMAL,
                    registeredAt,
                    BeaconCoordinates.fromUuid(uuid)
            ));
        }
        return beacons;
    }

    /**
     * Parses {@code not_used_ip;health_status}; the gateway is identified by the packet's source address.
     */
    public GatewayRecord parseGatewayHealth(String record, String gatewayAddress) {
        FieldCursor cursor = new FieldCursor(record);
        cursor.next("gateway_ip");
        int healthStatus = HealthStatus.parse(cursor.next("health_status"));
        return new GatewayRecord(gatewayAddress, healthStatus);
    }

    /**
     * Parses {@code uuid;lbeacon_ts;lbeacon_ip;health_status}.
     */
    public BeaconHealthReport parseBeaconHealth(String record) {
        FieldCursor cursor = new FieldCursor(record);
        String uuid = cursor.next("lbeacon_uuid");
        long beaconTimestamp = cursor.nextEpochSecond("lbeacon_timestamp").getEpochSecond();
        String ipAddress = cursor.next("lbeacon_ip");
        int healthStatus = HealthStatus.parse(cursor.next("health_status"));
        return new BeaconHealthReport(uuid, beaconTimestamp, ipAddress, healthStatus);
    }

    private List<TrackingSample> readSamples(FieldCursor cursor, String beaconUuid, long latency) {
        int count = cursor.nextCount("object_count");
        List<TrackingSample> samples = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String mac = cursor.next("object_mac_address");
            Instant initialTimestamp = cursor.nextEpochSecond("initial_timestamp");
            Instant finalTimestamp = cursor.nextEpochSecond("final_timestamp");
            int rssi = cursor.nextInt("rssi");
            boolean panic = cursor.nextInt("panic_button") == 1;
            BigDecimal batteryVoltage = cursor.nextDecimal("battery_voltage");

            samples.add(new TrackingSample(
                    mac,
                    beaconUuid,
                    rssi,
                    initialTimestamp,
                    finalTimestamp,
                    panic,
                    batteryVoltage,
                    latency
            ));
        }
        return samples;
    }

    private static int requirePositive(int count, String name) {
        if (count <= 0) {
            throw new ProtocolFormatException("Field '" + name + "' must be positive: " + count);
        }
        return count;
    }
}
