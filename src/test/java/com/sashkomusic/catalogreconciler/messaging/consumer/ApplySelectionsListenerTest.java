package com.sashkomusic.catalogreconciler.messaging.consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.sashkomusic.catalogreconciler.domain.exception.InvalidInputException;
import com.sashkomusic.catalogreconciler.domain.model.BatchResult;
import com.sashkomusic.catalogreconciler.domain.model.ReconciliationResult;
import com.sashkomusic.catalogreconciler.domain.model.TrackSelection;
import com.sashkomusic.catalogreconciler.domain.service.ReconciliationOrchestrator;
import com.sashkomusic.catalogreconciler.messaging.consumer.dto.ApplySelectionsTaskDto;
import com.sashkomusic.catalogreconciler.messaging.producer.ReconciliationResultProducer;
import com.sashkomusic.catalogreconciler.messaging.producer.dto.ReconciliationCompleteDto;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ApplySelectionsListenerTest {

    private final ReconciliationOrchestrator orchestrator = mock(ReconciliationOrchestrator.class);
    private final ReconciliationResultProducer producer = mock(ReconciliationResultProducer.class);
    private final ApplySelectionsListener listener = new ApplySelectionsListener(orchestrator, producer);

    @Test
    void selectionsArePassedThroughAndResultPublished() {
        List<TrackSelection> selections = List.of(TrackSelection.notInCatalog(5L));
        when(orchestrator.applySelections(selections))
                .thenReturn(BatchResult.of(List.of(ReconciliationResult.notSelected(5L))));

        listener.handleApplyTask(new ApplySelectionsTaskDto("req-9", selections));

        ArgumentCaptor<ReconciliationCompleteDto> captor = ArgumentCaptor.forClass(ReconciliationCompleteDto.class);
        verify(producer).send(captor.capture());
        assertTrue(captor.getValue().success());
        assertEquals(1, captor.getValue().result().failedCount());
    }

    @Test
    void emptySelectionsAreAnsweredWithFailure() {
        when(orchestrator.applySelections(List.of())).thenThrow(new InvalidInputException("No track selections supplied"));

        listener.handleApplyTask(new ApplySelectionsTaskDto("req-10", List.of()));

        ArgumentCaptor<ReconciliationCompleteDto> captor = ArgumentCaptor.forClass(ReconciliationCompleteDto.class);
        verify(producer).send(captor.capture());
        assertFalse(captor.getValue().success());
        assertEquals("No track selections supplied", captor.getValue().message());
    }
}
