package com.flagship.escrow_engine.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, ProcessedEventEntity.Key> {

    boolean existsByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);
}
