package com.koni.tracking.application.service;

import com.koni.tracking.domain.model.GeoFenceMonitoredObject;
import com.koni.tracking.domain.model.GeoFenceSetting;
import com.koni.tracking.domain.repository.GeoFenceRepository;
import com.koni.tracking.domain.store.DataStoreSession;
import com.koni.tracking.infrastructure.config.TrackingProperties;
import com.koni.tracking.infrastructure.persistence.pool.TestConnectionPools;
import com.koni.tracking.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Unit tests for GeoFenceExportService.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class GeoFenceExportServiceTest {

    @TempDir
    Path exportDirectory;

    @Mock
    private DataStoreSession session;

    @Mock
    private GeoFenceRepository geoFenceRepository;

    private final TrackingProperties properties = new TrackingProperties();
    private GeoFenceExportService service;

    @BeforeEach
    void setUp() {
        properties.getExport().setGeofenceSettingsFile(exportDirectory.resolve("geofence/settings.txt"));
        properties.getExport().setGeofenceObjectsFile(exportDirectory.resolve("geofence/objects.txt"));
        service = new GeoFenceExportService(TestConnectionPools.over(session, 1), geoFenceRepository, properties);
    }

    @Test
    void shouldDumpActiveSettingsAndMonitoredObjects() throws IOException {
        // Given
        when(geoFenceRepository.findActiveSettings(session)).thenReturn(List.of(
                new GeoFenceSetting(1, 10L, "ward-a", "3,1000,1000,2000,2000,3000,3000", "1,00010018000000003460000000000011,-60")));
        when(geoFenceRepository.findMonitoredObjects(session)).thenReturn(List.of(
                new GeoFenceMonitoredObject(1, "AA:BB:CC:DD:EE:01"),
                new GeoFenceMonitoredObject(2, "AA:BB:CC:DD:EE:02")));

        // When
        service.export();

        // Then
        assertThat(Files.readAllLines(exportDirectory.resolve("geofence/settings.txt")))
                .containsExactly("1;10;ward-a;3,1000,1000,2000,2000,3000,3000;1,00010018000000003460000000000011,-60;");
        assertThat(Files.readAllLines(exportDirectory.resolve("geofence/objects.txt")))
                .containsExactly("1;AA:BB:CC:DD:EE:01;", "2;AA:BB:CC:DD:EE:02;");
    }

    @Test
    void shouldTruncatePreviousDumpWhenNothingIsMonitored() throws IOException {
        // Given
        Path objects = exportDirectory.resolve("geofence/objects.txt");
        Files.createDirectories(objects.getParent());
        Files.writeString(objects, "1;AA:BB:CC:DD:EE:01;\n");
        when(geoFenceRepository.findActiveSettings(session)).thenReturn(List.of());
        when(geoFenceRepository.findMonitoredObjects(session)).thenReturn(List.of());

        // When
        service.export();

        // Then
        assertThat(Files.readAllLines(objects)).isEmpty();
    }
}
