package com.Unthinkable.TaskAssigner.config;

import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.annotation.EnableRabbit;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Queue used when {@code app.processing.async=true}. Listener startup follows the same flag,
 * so synchronous deployments never need a broker.
 */
@Configuration
@EnableRabbit
public class RabbitConfig {

    @Bean
    public Queue transcriptJobQueue(@Value("${app.rabbitmq.queue}") String name) {
        return QueueBuilder.durable(name).build();
    }

    @Bean
    public DirectExchange transcriptJobExchange(@Value("${app.rabbitmq.exchange}") String name) {
        return ExchangeBuilder.directExchange(name).durable(true).build();
    }

    @Bean
    public Binding transcriptJobBinding(Queue transcriptJobQueue, DirectExchange transcriptJobExchange,
                                        @Value("${app.rabbitmq.routing}") String routingKey) {
        return BindingBuilder.bind(transcriptJobQueue).to(transcriptJobExchange).with(routingKey);
    }

    @Bean
    public Jackson2JsonMessageConverter transcriptJobConverter() {
        return new Jackson2JsonMessageConverter();
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory,
                                         @Value("${app.rabbitmq.exchange}") String exchange,
                                         @Value("${app.rabbitmq.routing}") String routingKey,
                                         Jackson2JsonMessageConverter transcriptJobConverter) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setExchange(exchange);
        template.setRoutingKey(routingKey);
        template.setMessageConverter(transcriptJobConverter);
        return template;
    }
}
