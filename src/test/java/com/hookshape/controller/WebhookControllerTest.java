package com.hookshape.controller;

import com.hookshape.dto.ProcessingOutcome;
import com.hookshape.dto.RawDelivery;
import com.hookshape.model.EventCategory;
import com.hookshape.model.OutcomeStatus;
import com.hookshape.model.RejectionReason;
import com.hookshape.service.DeliveryProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class WebhookControllerTest {

    private static final String BODY = "{\"customer_id\": \"C-100\", \"dealer_id\": \"D-7\"}";

    @Mock private DeliveryProcessor processor;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new WebhookController(processor)).build();
    }

    @Test
    @DisplayName("A classified delivery is accepted with the outcome body")
    void accepted() throws Exception {
        when(processor.handle(eq(EventCategory.APPOINTMENT), any(RawDelivery.class)))
                .thenReturn(ProcessingOutcome.builder()
                        .status(OutcomeStatus.CLASSIFIED)
                        .eventType("missed")
                        .fingerprint("fp-1")
                        .build());

        mockMvc.perform(post("/api/webhooks/appointments")
                        .header(WebhookController.IDEMPOTENCY_KEY, "dlv-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.event_type").value("missed"))
                .andExpect(jsonPath("$.fingerprint").value("fp-1"));

        ArgumentCaptor<RawDelivery> delivery = ArgumentCaptor.forClass(RawDelivery.class);
        verify(processor).handle(eq(EventCategory.APPOINTMENT), delivery.capture());
        assertEquals("dlv-1", delivery.getValue().getDeliveryId());
        assertEquals("appointments", delivery.getValue().getCategory());
    }

    @Test
    @DisplayName("A rejected delivery is 422 with the reason")
    void rejected() throws Exception {
        when(processor.handle(eq(EventCategory.STATUS), any(RawDelivery.class)))
                .thenReturn(ProcessingOutcome.builder()
                        .status(OutcomeStatus.REJECTED)
                        .rejectionReason(RejectionReason.UNRECOGNIZED_SHAPE)
                        .build());

        mockMvc.perform(post("/api/webhooks/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.rejection_reason").value("UNRECOGNIZED_SHAPE"));
    }

    @Test
    @DisplayName("An unknown category is 404 and never reaches the processor")
    void unknownCategory() throws Exception {
        mockMvc.perform(post("/api/webhooks/invoices")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isNotFound());

        verifyNoInteractions(processor);
    }
}
