package com.koni.tracking.infrastructure.web.controller;

import com.koni.tracking.application.query.GetTagSummariesQuery;
import com.koni.tracking.application.query.GetTagSummariesQueryHandler;
import com.koni.tracking.application.query.TagSummaryResponse;
import com.koni.tracking.tags.UnitTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for TagController.
 */
@UnitTest
@WebMvcTest(TagController.class)
class TagControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GetTagSummariesQueryHandler queryHandler;

    @Test
    void shouldReturnAllTagSummaries() throws Exception {
        // Given
        TagSummaryResponse tag = new TagSummaryResponse(
                "AA:BB:CC:DD:EE:01",
                "00010018000000003460000000000011",
                -58,
                Instant.parse("2024-03-01T09:55:00Z"),
                Instant.parse("2024-03-01T10:00:00Z"),
                new BigDecimal("2.9"),
                3460,
                11,
                null,
                null,
                null,
                null);
        when(queryHandler.handle(any(GetTagSummariesQuery.class))).thenReturn(List.of(tag));

        // When/Then
        mockMvc.perform(get("/api/v1/tags"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].mac").value("AA:BB:CC:DD:EE:01"))
                .andExpect(jsonPath("$[0].rssi").value(-58))
                .andExpect(jsonPath("$[0].anchorX").value(3460))
                .andExpect(jsonPath("$[0].anchorY").value(11));
    }

    @Test
    void shouldReturnEmptyListWhenNoTagHasReported() throws Exception {
        // Given
        when(queryHandler.handle(any(GetTagSummariesQuery.class))).thenReturn(Collections.emptyList());

        // When/Then
        mockMvc.perform(get("/api/v1/tags"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }
}
