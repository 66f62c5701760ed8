package com.sashkomusic.catalogreconciler.domain.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sashkomusic.catalogreconciler.domain.model.TrackCandidateSet;
import com.sashkomusic.catalogreconciler.domain.model.TrackSelection;
import com.sashkomusic.catalogreconciler.domain.service.ManualSelectionCoordinator.PlannedSelection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ManualSelectionCoordinatorTest {

    private final SteppingClock clock = new SteppingClock(Instant.parse("2024-05-01T10:00:00Z"));
    private ManualSelectionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = new ManualSelectionCoordinator(Duration.ofHours(24), clock);
        coordinator.register(List.of(
                TrackCandidateSet.withCandidates(TestTracks.track(1L, "Strobe", "deadmau5", null),
                        List.of(TestTracks.candidate(100L, "Strobe", "deadmau5"),
                                TestTracks.candidate(101L, "Strobe", "deadmau5"))),
                TrackCandidateSet.withCandidates(TestTracks.track(2L, "Opus", "Eric Prydz", null),
                        List.of(TestTracks.candidate(200L, "Opus", "Eric Prydz"))),
                TrackCandidateSet.withError(TestTracks.track(3L, "Sandstorm", "Darude", null), "HTTP 429")));
    }

    @Test
    void resolveKeepsCallerOrderAndReleasesConsumedSets() {
        List<PlannedSelection> plan = coordinator.resolve(List.of(
                new TrackSelection(2L, 200L),
                new TrackSelection(1L, 101L)));

        assertEquals(List.of(2L, 1L), plan.stream().map(p -> p.selection().localTrackId()).toList());
        assertTrue(plan.get(0).chosenWasOffered());
        assertTrue(plan.get(1).chosenWasOffered());
        assertEquals(1, coordinator.pendingCount());
    }

    @Test
    void duplicateSelectionKeepsTheFirstOne() {
        List<PlannedSelection> plan = coordinator.resolve(List.of(
                new TrackSelection(1L, 100L),
                new TrackSelection(1L, 101L)));

        assertEquals(1, plan.size());
        assertEquals(100L, plan.get(0).selection().chosenCatalogId());
    }

    @Test
    void selectionOutsideOfferedCandidatesIsAllowed() {
        List<PlannedSelection> plan = coordinator.resolve(List.of(new TrackSelection(1L, 999L)));

        assertEquals(1, plan.size());
        assertFalse(plan.get(0).chosenWasOffered());
        assertEquals(999L, plan.get(0).selection().chosenCatalogId());
    }

    @Test
    void selectionWithoutPriorSearchIsPlannedWithoutOfferedSet() {
        List<PlannedSelection> plan = coordinator.resolve(List.of(new TrackSelection(77L, 700L)));

        assertEquals(1, plan.size());
        assertNull(plan.get(0).offered());
        assertEquals(3, coordinator.pendingCount());
    }

    @Test
    void notInCatalogSelectionStillConsumesPendingSet() {
        List<PlannedSelection> plan = coordinator.resolve(List.of(TrackSelection.notInCatalog(3L)));

        assertTrue(plan.get(0).selection().chosen().isEmpty());
        assertFalse(plan.get(0).chosenWasOffered());
        assertEquals(2, coordinator.pendingCount());
    }

    @Test
    void reRegisteringTrackReplacesItsCandidates() {
        coordinator.register(List.of(TrackCandidateSet.withCandidates(TestTracks.track(1L, "Strobe", "deadmau5", null),
                List.of(TestTracks.candidate(555L, "Strobe", "deadmau5")))));

        List<PlannedSelection> plan = coordinator.resolve(List.of(new TrackSelection(1L, 555L)));

        assertTrue(plan.get(0).chosenWasOffered());
        assertEquals(2, coordinator.pendingCount());
    }

    @Test
    void setsNeverFollowedBySelectionExpire() {
        clock.advance(Duration.ofHours(23));
        coordinator.register(List.of(TrackCandidateSet.withCandidates(TestTracks.track(4L, "Opus", "Eric Prydz", null),
                List.of(TestTracks.candidate(400L, "Opus", "Eric Prydz")))));
        assertEquals(4, coordinator.pendingCount());

        clock.advance(Duration.ofHours(2));
        List<PlannedSelection> plan = coordinator.resolve(List.of(new TrackSelection(1L, 100L)));

        assertNull(plan.get(0).offered());
        assertEquals(1, coordinator.pendingCount());
    }

    private static final class SteppingClock extends Clock {

        private Instant now;

        private SteppingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
