package com.al.clinicalsummary.config;

import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RabbitMQConfig {

    public static final String RETRY_ROUTING_PREFIX = "clinical.notes.retry.";

    @Value("${app.rabbitmq.queue}")
    private String queueName;

    @Value("${app.rabbitmq.dlq}")
    private String dlqName;

    @Value("${app.rabbitmq.dlx}")
    private String dlxName;

    @Value("${app.rabbitmq.dl-routingkey}")
    private String dlRoutingKey;

    @Value("${app.rabbitmq.exchange}")
    private String exchangeName;

    @Value("${app.rabbitmq.routingkey}")
    private String routingKey;

    @Bean
    Queue queue() {
        return QueueBuilder.durable(queueName)
                .withArgument("x-dead-letter-exchange", dlxName)
                .withArgument("x-dead-letter-routing-key", dlRoutingKey)
                .build();
    }

    @Bean
    Exchange exchange() {
        return ExchangeBuilder.topicExchange(exchangeName).durable(true).build();
    }

    @Bean
    Binding binding() {
        return BindingBuilder.bind(queue())
                .to(exchange())
                .with(routingKey)
                .noargs();
    }

    @Bean
    Queue deadLetterQueue() {
        return QueueBuilder.durable(dlqName).build();
    }

    @Bean
    Exchange deadLetterExchange() {
        return ExchangeBuilder.directExchange(dlxName).durable(true).build();
    }

    @Bean
    Binding deadLetterBinding() {
        return BindingBuilder.bind(deadLetterQueue())
                .to(deadLetterExchange())
                .with(dlRoutingKey)
                .noargs();
    }

    // Retry queues park a message for 5s, 15s, 45s and then dead-letter it back to the main exchange

    @Bean
    Queue notesRetryQueue1() {
        return retryQueue(1, 5000);
    }

    @Bean
    Binding notesRetryBinding1() {
        return retryBinding(notesRetryQueue1(), 1);
    }

    @Bean
    Queue notesRetryQueue2() {
        return retryQueue(2, 15000);
    }

    @Bean
    Binding notesRetryBinding2() {
        return retryBinding(notesRetryQueue2(), 2);
    }

    @Bean
    Queue notesRetryQueue3() {
        return retryQueue(3, 45000);
    }

    @Bean
    Binding notesRetryBinding3() {
        return retryBinding(notesRetryQueue3(), 3);
    }

    private Queue retryQueue(int attempt, int ttlMs) {
        return QueueBuilder.durable(queueName + "-retry-" + attempt)
                .withArgument("x-message-ttl", ttlMs)
                .withArgument("x-dead-letter-exchange", exchangeName)
                .withArgument("x-dead-letter-routing-key", routingKey)
                .build();
    }

    private Binding retryBinding(Queue retryQueue, int attempt) {
        return BindingBuilder.bind(retryQueue)
                .to(exchange())
                .with(RETRY_ROUTING_PREFIX + attempt)
                .noargs();
    }
}
