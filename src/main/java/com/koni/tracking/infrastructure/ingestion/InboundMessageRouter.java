package com.koni.tracking.infrastructure.ingestion;

import com.koni.tracking.application.command.RecordTrackingReportCommand;
import com.koni.tracking.application.command.RecordTrackingReportCommandHandler;
import com.koni.tracking.application.service.DeviceRegistrationService;
import com.koni.tracking.domain.exception.ProtocolFormatException;
import com.koni.tracking.infrastructure.observability.TrackingMetrics;
import com.koni.tracking.infrastructure.protocol.WireMessageParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Routes each inbound packet to the parser and handler of its message kind.
 * Runs on an ingestion worker thread.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InboundMessageRouter implements InboundMessageHandler {

    private final WireMessageParser parser;
    private final RecordTrackingReportCommandHandler trackingReportHandler;
    private final DeviceRegistrationService deviceRegistrationService;
    private final TrackingMetrics trackingMetrics;

    @Override
    public void handle(InboundPacket packet) {
        try {
            route(packet);
        } catch (ProtocolFormatException e) {
            trackingMetrics.recordParseFailure();
            log.warn("Malformed {} from {}: {}", packet.getKind(), packet.getSourceAddress(), e.getMessage());
            throw e;
        }
    }

    private void route(InboundPacket packet) {
        String content = packet.getContent();
        String gateway = packet.getSourceAddress();

        switch (packet.getKind()) {
            case TRACKING_REPORT:
                trackingReportHandler.handle(new RecordTrackingReportCommand(parser.parseTrackingReport(content)));
                break;
            case GATEWAY_REGISTRATION:
                deviceRegistrationService.registerGateways(parser.parseGatewayRegistration(content));
                break;
            case BEACON_REGISTRATION:
                deviceRegistrationService.registerBeacons(parser.parseBeaconRegistration(content, gateway));
                break;
            case GATEWAY_HEALTH:
                deviceRegistrationService.updateGatewayHealth(parser.parseGatewayHealth(content, gateway));
                break;
            case BEACON_HEALTH:
                deviceRegistrationService.updateBeaconHealth(parser.parseBeaconHealth(content), gateway);
                break;
            default:
                throw new IllegalStateException("Unhandled message kind: " + packet.getKind());
        }
    }
}
