package com.sashkomusic.catalogreconciler.messaging.producer;

import com.sashkomusic.catalogreconciler.messaging.producer.dto.ReconciliationCompleteDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class ReconciliationResultProducer {

    private final KafkaTemplate<String, ReconciliationCompleteDto> kafkaTemplate;
    private static final String TOPIC = "reconciliation-complete";

    public void send(ReconciliationCompleteDto message) {
        log.info("Sending reconciliation result: requestId={}, success={}, message={}",
                message.requestId(), message.success(), message.message());

        kafkaTemplate.send(TOPIC, message.requestId(), message);
    }
}
