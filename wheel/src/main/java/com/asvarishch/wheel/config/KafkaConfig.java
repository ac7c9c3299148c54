package com.asvarishch.wheel.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class KafkaConfig {

    @Value("${topic.name}")
    private String topicName;

    @Value("${topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic wheelEventsTopic() {
        log.info("Creating Kafka topic '{}' with {} partitions and RF=1", topicName, partitions);
        return new NewTopic(topicName, partitions, (short) 1);
    }
}
