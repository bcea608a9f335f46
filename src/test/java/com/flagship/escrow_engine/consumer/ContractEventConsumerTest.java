package com.flagship.escrow_engine.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.escrow_engine.referral.Referral;
import com.flagship.escrow_engine.referral.ReferralService;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.kafka.support.Acknowledgment;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ContractEventConsumerTest {

    @Mock
    private IdempotentEventProcessor eventProcessor;

    @Mock
    private ReferralService referralService;

    @Mock
    private Acknowledgment ack;

    private ContractEventConsumer consumer;

    @BeforeEach
    void setUp() {
        consumer = new ContractEventConsumer(eventProcessor, new ContractEventHandler(referralService), new ObjectMapper());
        when(eventProcessor.processEvent(any(), anyString(), anyString(), any(), anyString(), any()))
            .thenAnswer(inv -> {
                inv.<Runnable>getArgument(5).run();
                return true;
            });
        when(referralService.onFirstContractCompleted(any(), any())).thenReturn(Optional.empty());
    }

    private static ConsumerRecord<String, String> record(String value) {
        return new ConsumerRecord<>("contracts", 0, 42L, "key", value);
    }

    @Test
    @DisplayName("ContractCompleted checks the referrals of both parties")
    void testContractCompleted_ChecksBothParties() {
        UUID eventId = UUID.randomUUID();
        UUID contractId = UUID.randomUUID();
        UUID requester = UUID.randomUUID();
        UUID worker = UUID.randomUUID();
        Instant completedAt = Instant.parse("2026-09-10T12:00:00Z");
        when(referralService.onFirstContractCompleted(worker, completedAt)).thenReturn(Optional.of(
            Referral.register(UUID.randomUUID(), UUID.randomUUID(), worker, "ABC123", completedAt)));

        consumer.consume(record("""
            {"eventId":"%s","eventType":"ContractCompleted","contractId":"%s",
             "requesterId":"%s","workerId":"%s","occurredAt":"%s"}
            """.formatted(eventId, contractId, requester, worker, completedAt)), ack);

        verify(eventProcessor).processEvent(eq(eventId), eq("ContractCompleted"), eq("Contract"), eq(contractId),
            eq(ContractEventConsumer.CONSUMER_GROUP), any());
        verify(referralService).onFirstContractCompleted(requester, completedAt);
        verify(referralService).onFirstContractCompleted(worker, completedAt);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Other contract events are recorded as skipped")
    void testOtherEvent_Skipped() {
        UUID eventId = UUID.randomUUID();
        UUID contractId = UUID.randomUUID();

        consumer.consume(record("""
            {"eventId":"%s","eventType":"EscrowHeld","contractId":"%s"}
            """.formatted(eventId, contractId)), ack);

        verify(eventProcessor).skipEvent(eq(eventId), eq("EscrowHeld"), eq("Contract"), eq(contractId),
            eq(ContractEventConsumer.CONSUMER_GROUP), anyString());
        verify(referralService, never()).onFirstContractCompleted(any(), any());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Unparseable messages are acknowledged and dropped")
    void testPoisonMessage_Acknowledged() {
        consumer.consume(record("not json"), ack);
        consumer.consume(record("{\"eventId\":\"nope\",\"contractId\":\"x\"}"), ack);

        verify(ack, times(2)).acknowledge();
        verify(eventProcessor, never()).processEvent(any(), anyString(), anyString(), any(), anyString(), any());
    }

    @Test
    @DisplayName("A handler failure is rethrown without acknowledging")
    void testHandlerFailure_NotAcknowledged() {
        UUID requester = UUID.randomUUID();
        when(referralService.onFirstContractCompleted(eq(requester), any()))
            .thenThrow(new IllegalStateException("database down"));

        String value = """
            {"eventId":"%s","eventType":"ContractCompleted","contractId":"%s",
             "requesterId":"%s","workerId":"%s"}
            """.formatted(UUID.randomUUID(), UUID.randomUUID(), requester, UUID.randomUUID());

        assertThrows(IllegalStateException.class, () -> consumer.consume(record(value), ack));
        verify(ack, never()).acknowledge();
    }
}
