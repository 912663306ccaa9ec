package com.koni.tracking;

import com.koni.tracking.application.command.RecordTrackingReportCommand;
import com.koni.tracking.application.command.RecordTrackingReportCommandHandler;
import com.koni.tracking.application.query.GetTagSummariesQuery;
import com.koni.tracking.application.query.GetTagSummariesQueryHandler;
import com.koni.tracking.application.query.TagSummaryResponse;
import com.koni.tracking.application.service.DeviceRegistrationService;
import com.koni.tracking.application.service.LocationSummarizationService;
import com.koni.tracking.application.service.MaintenanceService;
import com.koni.tracking.application.service.MonitorScheduleService;
import com.koni.tracking.application.service.ViolationDetectionService;
import com.koni.tracking.domain.model.BeaconHealthReport;
import com.koni.tracking.domain.model.GatewayRecord;
import com.koni.tracking.domain.model.MonitorType;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionLease;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionPool;
import com.koni.tracking.infrastructure.protocol.WireMessageParser;
import com.koni.tracking.tags.IntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests of the tracking pipeline against a real PostgreSQL instance.
 * 
 * Tests:
 * - report ingestion, location summarization and the panic violation feed
 * - beacon registration and geofence breaches over HTTP
 * - monitor schedule refresh
 * - health reports from unknown and known devices
 * - retention and VACUUM
 */
@IntegrationTest
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
class TrackingPipelineIntegrationTest {

    private static final String TAG = "AA:BB:CC:DD:EE:01";
    private static final String BEACON = "00010018000000003460000000000011";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(
            DockerImageName.parse("postgres:16")
    )
            .withDatabaseName("tracking_test")
            .withUsername("test")
            .withPassword("test")
            .withInitScript("schema.sql");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("tracking.database.url", postgres::getJdbcUrl);
        registry.add("tracking.database.username", postgres::getUsername);
        registry.add("tracking.database.password", postgres::getPassword);
        registry.add("tracking.database.pool-size", () -> "4");
        registry.add("tracking.scheduling.enabled", () -> "false");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ConnectionPool connectionPool;

    @Autowired
    private WireMessageParser parser;

    @Autowired
    private RecordTrackingReportCommandHandler trackingReportHandler;

    @Autowired
    private DeviceRegistrationService deviceRegistrationService;

    @Autowired
    private LocationSummarizationService locationSummarizationService;

    @Autowired
    private ViolationDetectionService violationDetectionService;

    @Autowired
    private MonitorScheduleService monitorScheduleService;

    @Autowired
    private MaintenanceService maintenanceService;

    @Autowired
    private GetTagSummariesQueryHandler tagSummariesQueryHandler;

    @BeforeEach
    void setUp() {
        execute("TRUNCATE tracking_table, object_summary_table, object_table, notification_table, "
                + "lbeacon_table, gateway_table, rssi_weight_table, movement_config RESTART IDENTITY");
        execute("INSERT INTO object_table (mac_address, monitor_type, area_id) VALUES (?, ?, 1)",
                TAG, MonitorType.PANIC.getCode());
        execute("INSERT INTO object_summary_table (mac_address) VALUES (?)", TAG);
        execute("INSERT INTO rssi_weight_table (bottom_rssi, upper_rssi, weight) VALUES (-100, 0, 1)");
    }

    @Test
    void shouldLocateTagAndDeliverPanicExactlyOnce() throws Exception {
        // Given: a registered beacon and a report with one panic sample
        deviceRegistrationService.registerBeacons(
                parser.parseBeaconRegistration("1;0.0.0.0;" + BEACON + ";1700000000;10.0.0.5;", "192.168.1.10"));
        long now = Instant.now().getEpochSecond();
        String report = BEACON + ";" + now + ";10.0.0.5;0;0;1;1;"
                + TAG + ";" + (now - 5) + ";" + (now - 1) + ";-55;1;2.9;";

        // When
        trackingReportHandler.handle(new RecordTrackingReportCommand(parser.parseTrackingReport(report)));
        locationSummarizationService.summarize();

        // Then: the tag sits at the beacon it was heard by
        List<TagSummaryResponse> tags = tagSummariesQueryHandler.handle(new GetTagSummariesQuery());
        assertThat(tags).singleElement().satisfies(tag -> {
            assertThat(tag.getUuid()).isEqualTo(BEACON);
            assertThat(tag.getRssi()).isEqualTo(-55);
            assertThat(tag.getAnchorX()).isEqualTo(3460);
            assertThat(tag.getAnchorY()).isEqualTo(11);
            assertThat(tag.getPanicViolationTimestamp()).isNotNull();
        });

        // And the panic becomes one event, delivered once
        assertThat(violationDetectionService.collectEvents(MonitorType.PANIC)).isEqualTo(1);
        assertThat(violationDetectionService.collectEvents(MonitorType.PANIC)).isZero();

        mockMvc.perform(get("/api/v1/violations/feed"))
                .andExpect(status().isOk())
                .andExpect(content().string(startsWith("1,2," + TAG + "," + BEACON + ",")));
        mockMvc.perform(get("/api/v1/violations/feed"))
                .andExpect(status().isOk())
                .andExpect(content().string(""));
        assertThat(connectionPool.getInUse()).isZero();
    }

    @Test
    void shouldStampGeofenceBreachOnlyForKnownTags() throws Exception {
        // When/Then
        mockMvc.perform(post("/api/v1/geofence/breaches/" + TAG))
                .andExpect(status().isAccepted());
        mockMvc.perform(post("/api/v1/geofence/breaches/AA:BB:CC:DD:EE:99"))
                .andExpect(status().isNotFound());

        assertThat(violationDetectionService.collectEvents(MonitorType.GEO_FENCE)).isEqualTo(1);
    }

    @Test
    void shouldDeactivatePoliciesOutsideTheirWindow() {
        // Given: a disabled policy and an empty window, both flagged active
        execute("INSERT INTO movement_config (area_id, enable, start_time, end_time, is_active) "
                + "VALUES (1, 0, '00:00', '23:59', 1)");
        execute("INSERT INTO movement_config (area_id, enable, start_time, end_time, is_active) "
                + "VALUES (1, 1, '08:00', '08:00', 1)");

        // When
        int changed = monitorScheduleService.refreshAll();

        // Then
        assertThat(changed).isEqualTo(2);
        assertThat(query("SELECT COUNT(*) FROM movement_config WHERE is_active = 1")).isZero();
        assertThat(monitorScheduleService.refreshAll()).isZero();
    }

    @Test
    void shouldCreateUnknownDevicesAsNormalAndUpdateKnownOnes() {
        // Given: health reports with a fault status from devices never registered
        deviceRegistrationService.updateGatewayHealth(new GatewayRecord("10.9.9.9", 2));
        deviceRegistrationService.updateBeaconHealth(
                new BeaconHealthReport(BEACON, 1_699_990_000L, "10.0.0.5", 2), "10.9.9.9");

        // Then: both are created with the normal status
        assertThat(query("SELECT health_status FROM gateway_table WHERE ip_address = '10.9.9.9'")).isZero();
        assertThat(query("SELECT health_status FROM lbeacon_table WHERE uuid = '" + BEACON + "'")).isZero();

        // When: the same devices report again
        deviceRegistrationService.updateGatewayHealth(new GatewayRecord("10.9.9.9", 2));
        deviceRegistrationService.updateBeaconHealth(
                new BeaconHealthReport(BEACON, 1_699_990_000L, "10.0.0.5", 3), "10.9.9.9");

        // Then: the reported status is applied
        assertThat(query("SELECT health_status FROM gateway_table WHERE ip_address = '10.9.9.9'")).isEqualTo(2);
        assertThat(query("SELECT health_status FROM lbeacon_table WHERE uuid = '" + BEACON + "'")).isEqualTo(3);
    }

    @Test
    void shouldPurgeExpiredSamplesAndVacuum() {
        // Given
        execute("INSERT INTO tracking_table (object_mac_address, lbeacon_uuid, rssi, panic_button, battery_voltage, "
                + "initial_timestamp, final_timestamp, server_time_offset) "
                + "VALUES (?, ?, -60, 0, 3.0, NOW() - INTERVAL '3 days', NOW() - INTERVAL '3 days', 0), "
                + "(?, ?, -61, 0, 3.0, NOW(), NOW(), 0)", TAG, BEACON, TAG, BEACON);

        // When
        maintenanceService.deleteExpiredData();
        maintenanceService.vacuum();

        // Then
        assertThat(query("SELECT COUNT(*) FROM tracking_table")).isEqualTo(1);
        assertThat(connectionPool.getInUse()).isZero();
    }

    private void execute(String sql, Object... params) {
        try (ConnectionLease lease = connectionPool.acquire()) {
            lease.session().execute(sql, params);
        }
    }

    private long query(String sql) {
        try (ConnectionLease lease = connectionPool.acquire()) {
            return lease.session().query(sql, (row, rowNum) -> row.getLong(1)).get(0);
        }
    }
}
