package com.dyntable.tableservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 表引擎事件的交换机和队列配置
 */
@Configuration
public class RabbitMQConfig {

    @Value("${rabbitmq.exchanges.table-events}")
    private String tableEventsExchange;

    @Value("${rabbitmq.queues.inventory-transactions}")
    private String inventoryTransactionsQueue;

    @Value("${rabbitmq.queues.table-deleted}")
    private String tableDeletedQueue;

    @Value("${rabbitmq.routing-keys.transaction-recorded}")
    private String transactionRecordedRoutingKey;

    @Value("${rabbitmq.routing-keys.table-deleted}")
    private String tableDeletedRoutingKey;

    @Bean
    public DirectExchange tableEventsExchange() {
        return new DirectExchange(tableEventsExchange);
    }

    @Bean
    public Queue inventoryTransactionsQueue() {
        return QueueBuilder.durable(inventoryTransactionsQueue).build();
    }

    @Bean
    public Queue tableDeletedQueue() {
        return QueueBuilder.durable(tableDeletedQueue).build();
    }

    @Bean
    public Binding inventoryTransactionsBinding() {
        return BindingBuilder.bind(inventoryTransactionsQueue())
                .to(tableEventsExchange())
                .with(transactionRecordedRoutingKey);
    }

    @Bean
    public Binding tableDeletedBinding() {
        return BindingBuilder.bind(tableDeletedQueue())
                .to(tableEventsExchange())
                .with(tableDeletedRoutingKey);
    }

    // 使用应用的 ObjectMapper 序列化，java.time 字段输出为 ISO 字符串
    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory, ObjectMapper objectMapper) {
        RabbitTemplate rabbitTemplate = new RabbitTemplate(connectionFactory);
        rabbitTemplate.setMessageConverter(new Jackson2JsonMessageConverter(objectMapper));
        return rabbitTemplate;
    }
}
