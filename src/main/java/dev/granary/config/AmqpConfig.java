package dev.granary.config;

import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Declares the topic exchange receiving document events and makes the auto-configured {@code
 * RabbitTemplate} send JSON.
 */
@Configuration
public class AmqpConfig {

    @Bean
    public TopicExchange documentEventsExchange(
            @Value("${granary.events.exchange:granary.events}") String exchange) {
        return new TopicExchange(exchange, true, false);
    }

    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }
}
