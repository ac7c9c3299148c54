package com.asvarishch.wheel.listener;

import com.asvarishch.wheel.event.WheelEvent;
import com.asvarishch.wheel.kafka.WheelEventProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards wheel notifications to Kafka. Runs only after the wheel transaction commits,
 * so a rolled-back operation never produces a notification.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WheelEventRelay {

    private final WheelEventProducer producer;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onWheelEvent(WheelEvent event) {
        try {
            producer.send(event);
        } catch (RuntimeException e) {
            // The wheel change is already committed; the notification is informational.
            log.error("Failed to relay wheel event type={}, wheelId={}", event.type(), event.wheelId(), e);
        }
    }
}
