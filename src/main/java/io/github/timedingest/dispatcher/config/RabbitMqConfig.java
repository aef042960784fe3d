package io.github.timedingest.dispatcher.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RabbitMqConfig {

    // Messages that exhaust the listener retries are rejected without requeue and land here.
    @Bean
    public Queue ingestionQueue(@Value("${app.rabbitmq.queue.ingestion}") String queueName,
                                @Value("${app.rabbitmq.queue.dead-letter}") String deadLetterQueue,
                                @Value("${app.rabbitmq.dead-letter-exchange}") String deadLetterExchange) {
        return QueueBuilder.durable(queueName)
                .deadLetterExchange(deadLetterExchange)
                .deadLetterRoutingKey(deadLetterQueue)
                .build();
    }

    @Bean
    public DirectExchange deadLetterExchange(@Value("${app.rabbitmq.dead-letter-exchange}") String exchange) {
        return new DirectExchange(exchange, true, false);
    }

    @Bean
    public Queue deadLetterQueue(@Value("${app.rabbitmq.queue.dead-letter}") String queueName) {
        return QueueBuilder.durable(queueName).build();
    }

    @Bean
    public Binding deadLetterBinding(Queue deadLetterQueue, DirectExchange deadLetterExchange) {
        return BindingBuilder.bind(deadLetterQueue).to(deadLetterExchange).with(deadLetterQueue.getName());
    }

    @Bean
    public DirectExchange outcomesExchange(@Value("${app.rabbitmq.outcomes.exchange}") String exchange) {
        return new DirectExchange(exchange, true, false);
    }

    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }
}
