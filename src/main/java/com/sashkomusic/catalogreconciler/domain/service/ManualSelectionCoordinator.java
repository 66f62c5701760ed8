package com.sashkomusic.catalogreconciler.domain.service;

import com.sashkomusic.catalogreconciler.config.ReconciliationConfig;
import com.sashkomusic.catalogreconciler.domain.model.TrackCandidateSet;
import com.sashkomusic.catalogreconciler.domain.model.TrackSelection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the candidate sets handed out by a candidate search until the user's selections for them
 * come back, or until they are older than the configured time to live. Does no matching of its own.
 */
@Slf4j
@Service
public class ManualSelectionCoordinator {

    private final ConcurrentHashMap<Long, Pending> pendingSets = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public ManualSelectionCoordinator(ReconciliationConfig config) {
        this(config.getPendingSelectionTtl(), Clock.systemUTC());
    }

    ManualSelectionCoordinator(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public void register(List<TrackCandidateSet> candidateSets) {
        evictExpired();
        Instant now = clock.instant();
        for (TrackCandidateSet set : candidateSets) {
            if (set.localTrackId() == null) {
                continue;
            }
            pendingSets.put(set.localTrackId(), new Pending(set, now));
        }
        log.debug("Registered {} candidate sets, {} pending in total", candidateSets.size(), pendingSets.size());
    }

    /**
     * Pairs each selection with the candidate set previously offered for its track, in caller
     * order. Selections may pick an id that was never offered, and tracks left out by the caller
     * are simply not part of the plan. A repeated track id keeps its first selection.
     */
    public List<PlannedSelection> resolve(List<TrackSelection> selections) {
        evictExpired();
        List<PlannedSelection> plan = new ArrayList<>();
        Set<Long> seen = new HashSet<>();

        for (TrackSelection selection : selections) {
            if (selection == null || selection.localTrackId() == null) {
                log.warn("Ignoring selection without a local track id");
                continue;
            }
            if (!seen.add(selection.localTrackId())) {
                log.warn("Duplicate selection for track {} ignored, keeping the first one", selection.localTrackId());
                continue;
            }

            Pending pending = pendingSets.remove(selection.localTrackId());
            TrackCandidateSet offered = pending != null ? pending.set() : null;
            if (offered == null) {
                log.debug("No pending candidate set for track {}", selection.localTrackId());
            } else if (selection.chosenCatalogId() != null && !offered.offers(selection.chosenCatalogId())) {
                log.info("Track {}: catalog id {} was not among the offered candidates, applying it anyway",
                        selection.localTrackId(), selection.chosenCatalogId());
            }

            plan.add(new PlannedSelection(selection, offered));
        }

        return plan;
    }

    public int pendingCount() {
        return pendingSets.size();
    }

    private void evictExpired() {
        Instant cutoff = clock.instant().minus(ttl);
        int before = pendingSets.size();
        pendingSets.values().removeIf(pending -> pending.registeredAt().isBefore(cutoff));
        int evicted = before - pendingSets.size();
        if (evicted > 0) {
            log.info("Dropped {} candidate sets that were never followed by a selection", evicted);
        }
    }

    private record Pending(TrackCandidateSet set, Instant registeredAt) {
    }

    public record PlannedSelection(TrackSelection selection, TrackCandidateSet offered) {

        public boolean chosenWasOffered() {
            return offered != null
                    && selection.chosenCatalogId() != null
                    && offered.offers(selection.chosenCatalogId());
        }
    }
}
