package com.sashkomusic.catalogreconciler.messaging.producer;

import com.sashkomusic.catalogreconciler.domain.model.ProgressEvent;
import com.sashkomusic.catalogreconciler.domain.port.ProgressNotifier;
import com.sashkomusic.catalogreconciler.messaging.producer.dto.ReconciliationProgressDto;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Publishes progress from a single background sender. Callers only enqueue; when the broker is
 * slow and the queue fills up, the oldest pending update is dropped.
 */
@Component
@Slf4j
public class ReconciliationProgressProducer implements ProgressNotifier {

    private static final String TOPIC = "reconciliation-progress";
    private static final int QUEUE_CAPACITY = 256;

    private final KafkaTemplate<String, ReconciliationProgressDto> kafkaTemplate;
    private final ExecutorService sender;

    @Autowired
    public ReconciliationProgressProducer(KafkaTemplate<String, ReconciliationProgressDto> kafkaTemplate) {
        this(kafkaTemplate, newSender(QUEUE_CAPACITY));
    }

    ReconciliationProgressProducer(KafkaTemplate<String, ReconciliationProgressDto> kafkaTemplate,
                                   ExecutorService sender) {
        this.kafkaTemplate = kafkaTemplate;
        this.sender = sender;
    }

    @Override
    public void notify(ProgressEvent event) {
        ReconciliationProgressDto message = new ReconciliationProgressDto(
                event.currentIndex(), event.total(), event.currentTrackTitle(), event.phase());

        log.debug("Sending progress {}/{} {}: {}",
                event.currentIndex(), event.total(), event.phase().wireName(), event.currentTrackTitle());

        try {
            sender.execute(() -> send(message));
        } catch (RejectedExecutionException e) {
            log.debug("Progress sender stopped, dropping {}/{}", event.currentIndex(), event.total());
        }
    }

    @PreDestroy
    public void shutdown() {
        sender.shutdown();
    }

    private void send(ReconciliationProgressDto message) {
        try {
            kafkaTemplate.send(TOPIC, message).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.debug("Progress message not delivered: {}", ex.getMessage());
                }
            });
        } catch (RuntimeException e) {
            log.debug("Progress message not sent: {}", e.getMessage());
        }
    }

    static ExecutorService newSender(int queueCapacity) {
        return new ThreadPoolExecutor(
                1,
                1,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                runnable -> {
                    Thread thread = new Thread(runnable, "progress-sender");
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.DiscardOldestPolicy());
    }
}
