package com.asvarishch.wheel.kafka;

import com.asvarishch.wheel.event.WheelEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class WheelEventProducer {

    private final KafkaTemplate<String, WheelEvent> kafkaTemplate;

    @Value("${topic.name}")
    private String topic;

    /** Uses wheelId as key so one wheel's events stay ordered within a partition. */
    public void send(WheelEvent event) {
        log.info("Publishing wheel event: type={}, wheelId={}, address={}, prizeIndex={}, amount={}",
                event.type(), event.wheelId(), event.address(), event.prizeIndex(), event.amount());
        kafkaTemplate.send(topic, String.valueOf(event.wheelId()), event);
    }
}
