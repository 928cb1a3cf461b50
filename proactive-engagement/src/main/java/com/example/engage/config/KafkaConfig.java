package com.example.engage.config;

import com.example.engage.event.EngagementEvent;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

@Configuration
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, EngagementEvent> engagementEventProducerFactory(KafkaProperties properties) {
        return new DefaultKafkaProducerFactory<>(properties.buildProducerProperties(null));
    }

    @Bean
    public KafkaTemplate<String, EngagementEvent> engagementEventKafkaTemplate(
            ProducerFactory<String, EngagementEvent> engagementEventProducerFactory) {
        return new KafkaTemplate<>(engagementEventProducerFactory);
    }

    @Bean
    public NewTopic lifecycleTopic(EngageProperties engageProperties) {
        return TopicBuilder.name(engageProperties.getKafka().getLifecycleTopic())
                .partitions(6)
                .replicas(1)
                .build();
    }
}
