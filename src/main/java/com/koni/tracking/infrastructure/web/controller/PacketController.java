package com.koni.tracking.infrastructure.web.controller;

import com.koni.tracking.infrastructure.ingestion.InboundPacket;
import com.koni.tracking.infrastructure.ingestion.IngestionDispatcher;
import com.koni.tracking.infrastructure.ingestion.MessageKind;
import com.koni.tracking.infrastructure.web.dto.ErrorResponse;
import com.koni.tracking.infrastructure.web.dto.PacketAcceptedResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller receiving gateway messages.
 * This controller handles the write path: it only hands the raw message to an
 * ingestion worker, parsing and persistence happen asynchronously.
 * 
 * Endpoints:
 * - POST /api/v1/packets/{kind}: Submit one message of the given kind
 *   (tracking-report, gateway-registration, beacon-registration, gateway-health, beacon-health)
 * 
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class PacketController {

    static final String GATEWAY_ADDRESS_HEADER = "X-Gateway-Address";

    private final IngestionDispatcher ingestionDispatcher;

    /**
     * Accepts a gateway message and dispatches it to a worker.
     * The sending gateway is taken from the {@code X-Gateway-Address} header, or from
     * the remote address when the header is absent.
     * 
     * Example request:
     * POST /api/v1/packets/tracking-report
     * Content-Type: text/plain
     * 
     * 00010018000000003460000000000011;1700000010;10.0.0.5;0;0;1;1;AA:BB:CC:DD:EE:01;1700000001;1700000009;-55;0;3.0;
     * 
     * @return 202 Accepted once a worker has taken the message,
     *         400 Bad Request for an unknown kind or an oversized message,
     *         503 Service Unavailable when shutting down
     */
    @PostMapping(value = "/v1/packets/{kind}", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<?> submitPacket(@PathVariable("kind") String kind,
                                          @RequestHeader(value = GATEWAY_ADDRESS_HEADER, required = false) String gatewayAddress,
                                          @RequestBody String content,
                                          HttpServletRequest request) {
        MessageKind messageKind = MessageKind.fromPathSegment(kind);
        String source = StringUtils.hasText(gatewayAddress) ? gatewayAddress.trim() : request.getRemoteAddr();

        log.debug("Received {} from {} ({} chars)", messageKind, source, content.length());

        try {
            ingestionDispatcher.dispatch(new InboundPacket(source, messageKind, content));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while dispatching {} from {}", messageKind, source);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse(HttpStatus.SERVICE_UNAVAILABLE.value(), "Service temporarily unavailable"));
        }

        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(new PacketAcceptedResponse(messageKind.getPathSegment(), source, content.length()));
    }
}
