package com.sashkomusic.catalogreconciler.messaging.consumer;

import com.sashkomusic.catalogreconciler.domain.exception.InvalidInputException;
import com.sashkomusic.catalogreconciler.domain.model.BatchResult;
import com.sashkomusic.catalogreconciler.domain.model.ReconciliationMode;
import com.sashkomusic.catalogreconciler.domain.service.ReconciliationOrchestrator;
import com.sashkomusic.catalogreconciler.messaging.consumer.dto.ReconcileTracksTaskDto;
import com.sashkomusic.catalogreconciler.messaging.producer.ReconciliationResultProducer;
import com.sashkomusic.catalogreconciler.messaging.producer.dto.ReconciliationCompleteDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class ReconcileTracksListener {

    private final ReconciliationOrchestrator orchestrator;
    private final ReconciliationResultProducer resultProducer;

    @KafkaListener(
            topics = "reconcile-tracks-tasks",
            concurrency = "1"
    )
    public void handleReconcileTask(ReconcileTracksTaskDto task) {
        ReconciliationMode mode = task.mode() != null ? task.mode() : ReconciliationMode.AUTOMATIC;
        log.info("Received reconcile task: requestId={}, tracks={}, mode={}",
                task.requestId(), task.trackIds() != null ? task.trackIds().size() : 0, mode);

        try {
            BatchResult result = orchestrator.reconcileBatch(task.trackIds(), mode);
            resultProducer.send(ReconciliationCompleteDto.completed(task.requestId(), result));

        } catch (InvalidInputException ex) {
            log.warn("Rejected reconcile task {}: {}", task.requestId(), ex.getMessage());
            resultProducer.send(ReconciliationCompleteDto.failed(task.requestId(), ex.getMessage()));

        } catch (Exception ex) {
            log.error("Fatal error during reconciliation: {}", ex.getMessage(), ex);
            resultProducer.send(ReconciliationCompleteDto.failed(task.requestId(), "Fatal error: " + ex.getMessage()));
        }
    }
}
