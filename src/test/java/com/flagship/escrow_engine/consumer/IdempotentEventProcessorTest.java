package com.flagship.escrow_engine.consumer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Idempotent consumption of contract events.
 *
 * - An event runs its handler once per consumer group
 * - Redelivered events are skipped
 * - A failing handler leaves no record, so the redelivery runs again
 * - Concurrent deliveries of one event leave a single record
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class IdempotentEventProcessorTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("escrow_engine_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("spring.kafka.producer.properties.max.block.ms", () -> "200");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("escrow.automation.enabled", () -> "false");
    }

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private ProcessedEventRepository repository;

    private static final String CONSUMER_GROUP = ContractEventConsumer.CONSUMER_GROUP;
    private static final String EVENT_TYPE = "ContractCompleted";
    private static final String AGGREGATE_TYPE = "Contract";

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private ProcessedEvent stored(UUID eventId, String consumerGroup) {
        return repository.findById(new ProcessedEventEntity.Key(eventId, consumerGroup))
            .orElseThrow()
            .toDomain();
    }

    @Test
    @DisplayName("First delivery runs the handler and records success")
    void testFirstEventProcessing_ExecutesHandler() {
        printTestHeader("First Event Processing - Executes Handler");

        UUID eventId = UUID.randomUUID();
        UUID contractId = UUID.randomUUID();
        AtomicInteger handlerCallCount = new AtomicInteger(0);

        boolean processed = eventProcessor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, contractId, CONSUMER_GROUP,
            handlerCallCount::incrementAndGet
        );

        assertTrue(processed);
        assertEquals(1, handlerCallCount.get());
        ProcessedEvent record = stored(eventId, CONSUMER_GROUP);
        assertEquals(ProcessedEvent.ProcessingResult.SUCCESS, record.getResult());
        assertEquals(contractId, record.getAggregateId());

        printSuccess("First event processed and recorded");
    }

    @Test
    @DisplayName("Redelivered events do not run the handler again")
    void testDuplicateEvent_SkipsHandler() {
        printTestHeader("Duplicate Event - Skips Handler");

        UUID eventId = UUID.randomUUID();
        UUID contractId = UUID.randomUUID();
        AtomicInteger handlerCallCount = new AtomicInteger(0);

        boolean first = eventProcessor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, contractId, CONSUMER_GROUP, handlerCallCount::incrementAndGet);
        boolean second = eventProcessor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, contractId, CONSUMER_GROUP, handlerCallCount::incrementAndGet);
        boolean third = eventProcessor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, contractId, CONSUMER_GROUP, handlerCallCount::incrementAndGet);

        assertTrue(first);
        assertFalse(second);
        assertFalse(third);
        assertEquals(1, handlerCallCount.get(), "Handler should only be called once");

        printSuccess("Duplicate deliveries skipped");
    }

    @Test
    @DisplayName("Each consumer group processes the same event once")
    void testDifferentConsumerGroups_ProcessSameEvent() {
        printTestHeader("Different Consumer Groups - Process Same Event");

        UUID eventId = UUID.randomUUID();
        UUID contractId = UUID.randomUUID();
        AtomicInteger totalCalls = new AtomicInteger(0);

        assertTrue(eventProcessor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, contractId, CONSUMER_GROUP, totalCalls::incrementAndGet));
        assertTrue(eventProcessor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, contractId, "notification-consumer", totalCalls::incrementAndGet));

        assertEquals(2, totalCalls.get());
        assertTrue(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP));
        assertTrue(eventProcessor.isAlreadyProcessed(eventId, "notification-consumer"));

        printSuccess("Consumer groups processed the event independently");
    }

    @Test
    @DisplayName("A failing handler leaves no record and the redelivery runs again")
    void testFailedProcessing_AllowsRedelivery() {
        printTestHeader("Failed Processing - Allows Redelivery");

        UUID eventId = UUID.randomUUID();
        UUID contractId = UUID.randomUUID();
        AtomicInteger handlerCallCount = new AtomicInteger(0);

        RuntimeException failure = assertThrows(RuntimeException.class, () ->
            eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, contractId, CONSUMER_GROUP, () -> {
                handlerCallCount.incrementAndGet();
                throw new IllegalStateException("referral store unavailable");
            }));
        assertEquals("referral store unavailable", failure.getMessage());
        assertFalse(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP));

        boolean redelivered = eventProcessor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, contractId, CONSUMER_GROUP, handlerCallCount::incrementAndGet);

        assertTrue(redelivered);
        assertEquals(2, handlerCallCount.get());
        assertEquals(ProcessedEvent.ProcessingResult.SUCCESS, stored(eventId, CONSUMER_GROUP).getResult());

        printSuccess("Failure rolled back and redelivery processed");
    }

    @Test
    @DisplayName("Concurrent deliveries of one event leave a single record")
    void testConcurrentProcessing_SingleRecord() throws InterruptedException {
        printTestHeader("Concurrent Processing - Single Record");

        UUID eventId = UUID.randomUUID();
        UUID contractId = UUID.randomUUID();
        AtomicInteger processedCount = new AtomicInteger(0);
        AtomicInteger rejectedCount = new AtomicInteger(0);

        int threadCount = 10;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    boolean processed = eventProcessor.processEvent(
                        eventId, EVENT_TYPE, AGGREGATE_TYPE, contractId, CONSUMER_GROUP, () -> { });
                    if (processed) {
                        processedCount.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (RuntimeException e) {
                    // primary key conflict for the losers; Kafka would redeliver and they would skip
                    rejectedCount.incrementAndGet();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        System.out.println("Processed: " + processedCount.get() + ", rejected: " + rejectedCount.get());

        assertEquals(1, processedCount.get(), "Exactly one delivery should commit");
        assertEquals(1, repository.count());
        assertFalse(eventProcessor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, contractId, CONSUMER_GROUP, () -> fail("must not run")));

        printSuccess("Only one delivery committed");
    }

    @Test
    @DisplayName("A skipped event is recorded and never processed later")
    void testSkipEvent_PreventsFutureProcessing() {
        printTestHeader("Skip Event - Prevents Future Processing");

        UUID eventId = UUID.randomUUID();
        UUID contractId = UUID.randomUUID();
        AtomicInteger handlerCallCount = new AtomicInteger(0);

        eventProcessor.skipEvent(eventId, "ContractCreated", AGGREGATE_TYPE, contractId, CONSUMER_GROUP,
            "Not relevant to referrals");
        eventProcessor.skipEvent(eventId, "ContractCreated", AGGREGATE_TYPE, contractId, CONSUMER_GROUP,
            "Not relevant to referrals");

        boolean processed = eventProcessor.processEvent(
            eventId, "ContractCreated", AGGREGATE_TYPE, contractId, CONSUMER_GROUP, handlerCallCount::incrementAndGet);

        assertFalse(processed);
        assertEquals(0, handlerCallCount.get());
        ProcessedEvent record = stored(eventId, CONSUMER_GROUP);
        assertEquals(ProcessedEvent.ProcessingResult.SKIPPED, record.getResult());
        assertEquals("Not relevant to referrals", record.getNote());

        printSuccess("Skipped event prevents future processing");
    }
}
