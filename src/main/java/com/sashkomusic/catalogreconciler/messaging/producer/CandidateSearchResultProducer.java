package com.sashkomusic.catalogreconciler.messaging.producer;

import com.sashkomusic.catalogreconciler.messaging.producer.dto.CandidateSearchCompleteDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class CandidateSearchResultProducer {

    private final KafkaTemplate<String, CandidateSearchCompleteDto> kafkaTemplate;
    private static final String TOPIC = "candidate-search-complete";

    public void send(CandidateSearchCompleteDto message) {
        log.info("Sending candidate search result: requestId={}, success={}, message={}",
                message.requestId(), message.success(), message.message());

        kafkaTemplate.send(TOPIC, message.requestId(), message);
    }
}
