package com.koni.tracking.infrastructure.web.controller;

import com.koni.tracking.application.service.ViolationDetectionService;
import com.koni.tracking.infrastructure.web.dto.ErrorResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives geofence breaches from the external geofence evaluator.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class GeoFenceController {

    private final ViolationDetectionService violationDetectionService;

    /**
     * @return 202 Accepted if the tag's geofence violation was stamped, 404 Not Found for an unknown tag
     */
    @PostMapping("/v1/geofence/breaches/{mac}")
    public ResponseEntity<?> reportBreach(@PathVariable("mac") String mac) {
        if (violationDetectionService.reportGeofenceBreach(mac)) {
            return ResponseEntity.accepted().build();
        }
        log.warn("Geofence breach for unknown tag {}", mac);
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse(HttpStatus.NOT_FOUND.value(), "Unknown tag: " + mac));
    }
}
