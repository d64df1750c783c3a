package com.dyntable.tableservice.service.message;

import com.dyntable.tableservice.entity.InventoryTransaction;
import com.dyntable.tableservice.exception.InternalEngineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class RabbitEngineEventPublisher implements EngineEventPublisher {

    private final RabbitTemplate rabbitTemplate;

    @Value("${rabbitmq.exchanges.table-events}")
    private String tableEventsExchange;

    @Value("${rabbitmq.routing-keys.transaction-recorded}")
    private String transactionRecordedRoutingKey;

    @Value("${rabbitmq.routing-keys.table-deleted}")
    private String tableDeletedRoutingKey;

    @Override
    public void publishTransactionRecorded(InventoryTransaction transaction) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("transactionId", transaction.getId());
        message.put("tableId", transaction.getTableId());
        message.put("tableName", transaction.getTableName());
        message.put("itemId", transaction.getItemId());
        message.put("type", transaction.getTransactionType().name());
        message.put("quantityChange", transaction.getQuantityChange());
        message.put("referenceId", transaction.getReferenceId());
        message.put("createdBy", transaction.getCreatedBy());
        message.put("createdAt", transaction.getCreatedAt());
        send(transactionRecordedRoutingKey, message, "transaction " + transaction.getId());
    }

    @Override
    public void publishTableDeleted(String tableId, String tableName) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("tableId", tableId);
        message.put("tableName", tableName);
        message.put("deletedAt", LocalDateTime.now());
        send(tableDeletedRoutingKey, message, "table deletion " + tableId);
    }

    private void send(String routingKey, Map<String, Object> message, String description) {
        try {
            rabbitTemplate.convertAndSend(tableEventsExchange, routingKey, message);
            log.debug("Published {} to {}", description, routingKey);
        } catch (AmqpException e) {
            log.error("Failed to publish {}", description, e);
            throw new InternalEngineException("Failed to publish " + description, e);
        }
    }
}
