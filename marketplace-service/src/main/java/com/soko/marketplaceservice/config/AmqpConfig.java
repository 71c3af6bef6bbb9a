package com.soko.marketplaceservice.config;

import org.springframework.amqp.core.*;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AmqpConfig {

    public static final String DLX_NAME = "dlx";
    public static final String DLQ_NAME = "q.dlq";
    public static final String DLQ_ROUTING_KEY = "dlq";

    public static final String MARKETPLACE_EXCHANGE = "marketplace_events_exchange";

    public static final String Q_SELLER_FANOUT = "q.marketplace.seller.fanout";
    public static final String Q_BUYER_UPDATES = "q.marketplace.buyer.updates";

    public static final String ROUTING_KEY_ORDER_PLACED = "order.placed";
    public static final String ROUTING_KEY_ORDER_STATUS_CHANGED = "order.status_changed";

    @Bean
    public TopicExchange deadLetterExchange() {
        return new TopicExchange(DLX_NAME);
    }

    @Bean
    public Queue deadLetterQueue() {
        return new Queue(DLQ_NAME);
    }

    @Bean
    public Binding deadLetterBinding() {
        return BindingBuilder.bind(deadLetterQueue()).to(deadLetterExchange()).with("#");
    }

    @Bean
    public TopicExchange marketplaceEventsExchange() {
        return new TopicExchange(MARKETPLACE_EXCHANGE);
    }

    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    @Bean
    public Queue sellerFanOutQueue() {
        return createDurableQueue(Q_SELLER_FANOUT);
    }

    @Bean
    public Binding sellerFanOutBinding(Queue sellerFanOutQueue, TopicExchange marketplaceEventsExchange) {
        return BindingBuilder.bind(sellerFanOutQueue).to(marketplaceEventsExchange).with(ROUTING_KEY_ORDER_PLACED);
    }

    @Bean
    public Queue buyerUpdatesQueue() {
        return createDurableQueue(Q_BUYER_UPDATES);
    }

    @Bean
    public Binding buyerUpdatesBinding(Queue buyerUpdatesQueue, TopicExchange marketplaceEventsExchange) {
        return BindingBuilder.bind(buyerUpdatesQueue).to(marketplaceEventsExchange)
                .with(ROUTING_KEY_ORDER_STATUS_CHANGED);
    }

    private Queue createDurableQueue(String queueName) {
        return QueueBuilder.durable(queueName)
                .withArgument("x-dead-letter-exchange", DLX_NAME)
                .withArgument("x-dead-letter-routing-key", DLQ_ROUTING_KEY)
                .build();
    }
}
