package com.sashkomusic.catalogreconciler.messaging.consumer;

import com.sashkomusic.catalogreconciler.domain.exception.InvalidInputException;
import com.sashkomusic.catalogreconciler.domain.model.CandidateSearchResult;
import com.sashkomusic.catalogreconciler.domain.service.ReconciliationOrchestrator;
import com.sashkomusic.catalogreconciler.messaging.consumer.dto.SearchCandidatesTaskDto;
import com.sashkomusic.catalogreconciler.messaging.producer.CandidateSearchResultProducer;
import com.sashkomusic.catalogreconciler.messaging.producer.dto.CandidateSearchCompleteDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class SearchCandidatesListener {

    private final ReconciliationOrchestrator orchestrator;
    private final CandidateSearchResultProducer resultProducer;

    @KafkaListener(
            topics = "search-candidates-tasks",
            concurrency = "1"
    )
    public void handleSearchTask(SearchCandidatesTaskDto task) {
        log.info("Received candidate search task: requestId={}, tracks={}",
                task.requestId(), task.trackIds() != null ? task.trackIds().size() : 0);

        try {
            CandidateSearchResult result = orchestrator.searchCandidatesForBatch(task.trackIds());
            resultProducer.send(CandidateSearchCompleteDto.completed(task.requestId(), result));

        } catch (InvalidInputException ex) {
            log.warn("Rejected candidate search task {}: {}", task.requestId(), ex.getMessage());
            resultProducer.send(CandidateSearchCompleteDto.failed(task.requestId(), ex.getMessage()));

        } catch (Exception ex) {
            log.error("Fatal error during candidate search: {}", ex.getMessage(), ex);
            resultProducer.send(CandidateSearchCompleteDto.failed(task.requestId(), "Fatal error: " + ex.getMessage()));
        }
    }
}
