package com.example.messenger.config;

import com.example.messenger.event.ChatEvent;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

@Configuration
@ConditionalOnProperty(prefix = "messenger.kafka", name = "relay-enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, ChatEvent> chatEventProducerFactory(KafkaProperties properties) {
        return new DefaultKafkaProducerFactory<>(properties.buildProducerProperties());
    }

    @Bean
    public KafkaTemplate<String, ChatEvent> chatEventKafkaTemplate(
            ProducerFactory<String, ChatEvent> chatEventProducerFactory) {
        return new KafkaTemplate<>(chatEventProducerFactory);
    }

    @Bean
    public NewTopic messengerEventsTopic(MessengerProperties messengerProperties) {
        return TopicBuilder.name(messengerProperties.getKafka().getEventsTopic())
                .partitions(6)
                .replicas(1)
                .build();
    }
}
