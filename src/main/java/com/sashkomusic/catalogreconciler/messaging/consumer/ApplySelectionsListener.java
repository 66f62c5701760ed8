package com.sashkomusic.catalogreconciler.messaging.consumer;

import com.sashkomusic.catalogreconciler.domain.exception.InvalidInputException;
import com.sashkomusic.catalogreconciler.domain.model.BatchResult;
import com.sashkomusic.catalogreconciler.domain.service.ReconciliationOrchestrator;
import com.sashkomusic.catalogreconciler.messaging.consumer.dto.ApplySelectionsTaskDto;
import com.sashkomusic.catalogreconciler.messaging.producer.ReconciliationResultProducer;
import com.sashkomusic.catalogreconciler.messaging.producer.dto.ReconciliationCompleteDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class ApplySelectionsListener {

    private final ReconciliationOrchestrator orchestrator;
    private final ReconciliationResultProducer resultProducer;

    @KafkaListener(
            topics = "apply-selections-tasks",
            concurrency = "1"
    )
    public void handleApplyTask(ApplySelectionsTaskDto task) {
        log.info("Received apply selections task: requestId={}, selections={}",
                task.requestId(), task.selections() != null ? task.selections().size() : 0);

        try {
            BatchResult result = orchestrator.applySelections(task.selections());
            resultProducer.send(ReconciliationCompleteDto.completed(task.requestId(), result));

        } catch (InvalidInputException ex) {
            log.warn("Rejected apply selections task {}: {}", task.requestId(), ex.getMessage());
            resultProducer.send(ReconciliationCompleteDto.failed(task.requestId(), ex.getMessage()));

        } catch (Exception ex) {
            log.error("Fatal error while applying selections: {}", ex.getMessage(), ex);
            resultProducer.send(ReconciliationCompleteDto.failed(task.requestId(), "Fatal error: " + ex.getMessage()));
        }
    }
}
