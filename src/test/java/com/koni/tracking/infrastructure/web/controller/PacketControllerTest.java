package com.koni.tracking.infrastructure.web.controller;

import com.koni.tracking.domain.exception.ProtocolFormatException;
import com.koni.tracking.infrastructure.ingestion.InboundPacket;
import com.koni.tracking.infrastructure.ingestion.IngestionDispatcher;
import com.koni.tracking.infrastructure.ingestion.MessageKind;
import com.koni.tracking.tags.UnitTest;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for PacketController.
 * 
 * Tests:
 * - accepted packets with and without the gateway address header
 * - unknown kinds and oversized messages
 * - submissions during shutdown
 */
@UnitTest
@WebMvcTest(PacketController.class)
class PacketControllerTest {

    private static final String TRACKING_REPORT =
            "00010018000000003460000000000011;1700000010;10.0.0.5;0;0;1;1;AA:BB:CC:DD:EE:01;1700000001;1700000009;-55;0;3.0;";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IngestionDispatcher ingestionDispatcher;

    @Test
    void shouldAcceptPacketFromGatewayHeader() throws Exception {
        // When
        mockMvc.perform(post("/api/v1/packets/tracking-report")
                        .contentType(MediaType.TEXT_PLAIN)
                        .header(PacketController.GATEWAY_ADDRESS_HEADER, "192.168.1.10")
                        .content(TRACKING_REPORT))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.kind").value("tracking-report"))
                .andExpect(jsonPath("$.sourceAddress").value("192.168.1.10"))
                .andExpect(jsonPath("$.length").value(TRACKING_REPORT.length()));

        // Then
        ArgumentCaptor<InboundPacket> captor = ArgumentCaptor.forClass(InboundPacket.class);
        verify(ingestionDispatcher).dispatch(captor.capture());
        assertThat(captor.getValue().getKind()).isEqualTo(MessageKind.TRACKING_REPORT);
        assertThat(captor.getValue().getSourceAddress()).isEqualTo("192.168.1.10");
        assertThat(captor.getValue().getContent()).isEqualTo(TRACKING_REPORT);
    }

    @Test
    void shouldFallBackToRemoteAddressWithoutGatewayHeader() throws Exception {
        // When
        mockMvc.perform(post("/api/v1/packets/gateway-health")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("0.0.0.0;0;")
                        .with(request -> {
                            request.setRemoteAddr("10.1.2.3");
                            return request;
                        }))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.sourceAddress").value("10.1.2.3"));

        // Then
        ArgumentCaptor<InboundPacket> captor = ArgumentCaptor.forClass(InboundPacket.class);
        verify(ingestionDispatcher).dispatch(captor.capture());
        assertThat(captor.getValue().getSourceAddress()).isEqualTo("10.1.2.3");
    }

    @Test
    void shouldRejectUnknownMessageKind() throws Exception {
        // When
        mockMvc.perform(post("/api/v1/packets/firmware-update")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("1;"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("Unknown message kind: firmware-update"));

        // Then
        verify(ingestionDispatcher, never()).dispatch(any());
    }

    @Test
    void shouldRejectOversizedMessage() throws Exception {
        // Given
        doThrow(new ProtocolFormatException("Message of 5000 bytes exceeds buffer capacity of 4096"))
                .when(ingestionDispatcher).dispatch(any());

        // When/Then
        mockMvc.perform(post("/api/v1/packets/tracking-report")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content(TRACKING_REPORT))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Message of 5000 bytes exceeds buffer capacity of 4096"));
    }

    @Test
    void shouldReturnServiceUnavailableDuringShutdown() throws Exception {
        // Given
        doThrow(new RejectedExecutionException("Ingestion dispatcher is shut down"))
                .when(ingestionDispatcher).dispatch(any());

        // When/Then
        mockMvc.perform(post("/api/v1/packets/beacon-health")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("00010018000000003460000000000011;1700000010;10.0.0.5;0;"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value("Service temporarily unavailable"));
    }
}
