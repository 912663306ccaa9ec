package com.koni.tracking.application.service;

import com.koni.tracking.domain.model.GeoFenceMonitoredObject;
import com.koni.tracking.domain.model.GeoFenceSetting;
import com.koni.tracking.domain.repository.GeoFenceRepository;
import com.koni.tracking.infrastructure.config.TrackingProperties;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionLease;
import com.koni.tracking.infrastructure.persistence.pool.ConnectionPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Dumps the active geofence configuration and the geofence-monitored objects
 * to plain text files read by the geofence evaluator.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GeoFenceExportService {

    private final ConnectionPool connectionPool;
    private final GeoFenceRepository geoFenceRepository;
    private final TrackingProperties properties;

    public void export() {
        List<GeoFenceSetting> settings;
        List<GeoFenceMonitoredObject> objects;
        try (ConnectionLease lease = connectionPool.acquire()) {
            settings = geoFenceRepository.findActiveSettings(lease.session());
            objects = geoFenceRepository.findMonitoredObjects(lease.session());
        }

        TrackingProperties.Export files = properties.getExport();
        write(files.getGeofenceSettingsFile(),
                settings.stream().map(GeoFenceSetting::toDumpLine).collect(Collectors.toList()));
        write(files.getGeofenceObjectsFile(),
                objects.stream().map(GeoFenceMonitoredObject::toDumpLine).collect(Collectors.toList()));

        log.info("Geofence dump written: settings={}, objects={}", settings.size(), objects.size());
    }

    private static void write(Path file, List<String> lines) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(file, lines, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write geofence dump " + file, e);
        }
    }
}
