package com.sashkomusic.catalogreconciler.domain.service;

import com.sashkomusic.catalogreconciler.config.ReconciliationConfig;
import com.sashkomusic.catalogreconciler.domain.exception.CatalogUnavailableException;
import com.sashkomusic.catalogreconciler.domain.exception.InvalidInputException;
import com.sashkomusic.catalogreconciler.domain.exception.ReconciliationException;
import com.sashkomusic.catalogreconciler.domain.exception.TagWriteException;
import com.sashkomusic.catalogreconciler.domain.model.BatchResult;
import com.sashkomusic.catalogreconciler.domain.model.CandidateSearchResult;
import com.sashkomusic.catalogreconciler.domain.model.CatalogCandidate;
import com.sashkomusic.catalogreconciler.domain.model.FullCatalogTags;
import com.sashkomusic.catalogreconciler.domain.model.LocalTrackRef;
import com.sashkomusic.catalogreconciler.domain.model.MergedTagSet;
import com.sashkomusic.catalogreconciler.domain.model.Outcome;
import com.sashkomusic.catalogreconciler.domain.model.ProgressEvent;
import com.sashkomusic.catalogreconciler.domain.model.ProgressPhase;
import com.sashkomusic.catalogreconciler.domain.model.ReconciliationMode;
import com.sashkomusic.catalogreconciler.domain.model.ReconciliationResult;
import com.sashkomusic.catalogreconciler.domain.model.TrackCandidateSet;
import com.sashkomusic.catalogreconciler.domain.model.TrackSelection;
import com.sashkomusic.catalogreconciler.domain.model.TrackState;
import com.sashkomusic.catalogreconciler.domain.port.CatalogPort;
import com.sashkomusic.catalogreconciler.domain.port.LocalTrackStore;
import com.sashkomusic.catalogreconciler.domain.port.ProgressNotifier;
import com.sashkomusic.catalogreconciler.domain.port.TagWriterPort;
import com.sashkomusic.catalogreconciler.domain.service.ManualSelectionCoordinator.PlannedSelection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Drives batches of local tracks through search, scoring, merge and write.
 * <p>
 * Tracks are processed strictly one after another. A failure on one track is recorded in its
 * result and the batch moves on; only invalid batch input fails the whole call.
 */
@Slf4j
@Service
public class ReconciliationOrchestrator {

    private final LocalTrackStore trackStore;
    private final CatalogPort catalog;
    private final TagWriterPort tagWriter;
    private final ProgressNotifier progressNotifier;
    private final TagMergeEngine mergeEngine;
    private final ManualSelectionCoordinator selectionCoordinator;
    private final PathMappingService pathMappingService;
    private final ReconciliationConfig config;
    private final RequestThrottle.Sleeper sleeper;

    @Autowired
    public ReconciliationOrchestrator(LocalTrackStore trackStore,
                                      CatalogPort catalog,
                                      TagWriterPort tagWriter,
                                      ProgressNotifier progressNotifier,
                                      TagMergeEngine mergeEngine,
                                      ManualSelectionCoordinator selectionCoordinator,
                                      PathMappingService pathMappingService,
                                      ReconciliationConfig config) {
        this(trackStore, catalog, tagWriter, progressNotifier, mergeEngine, selectionCoordinator,
                pathMappingService, config, Thread::sleep);
    }

    ReconciliationOrchestrator(LocalTrackStore trackStore,
                               CatalogPort catalog,
                               TagWriterPort tagWriter,
                               ProgressNotifier progressNotifier,
                               TagMergeEngine mergeEngine,
                               ManualSelectionCoordinator selectionCoordinator,
                               PathMappingService pathMappingService,
                               ReconciliationConfig config,
                               RequestThrottle.Sleeper sleeper) {
        this.trackStore = trackStore;
        this.catalog = catalog;
        this.tagWriter = tagWriter;
        this.progressNotifier = progressNotifier;
        this.mergeEngine = mergeEngine;
        this.selectionCoordinator = selectionCoordinator;
        this.pathMappingService = pathMappingService;
        this.config = config;
        this.sleeper = sleeper;
    }

    public BatchResult reconcileBatch(List<Long> trackIds, ReconciliationMode mode) {
        requireTrackIds(trackIds);
        if (mode == null || mode.stopsForSelection()) {
            throw new InvalidInputException("Mode " + mode
                    + " cannot run unattended, search candidates and apply selections instead");
        }

        log.info("Starting {} reconciliation of {} tracks", mode, trackIds.size());
        Batch batch = newBatch(trackIds.size());
        List<ReconciliationResult> results = new ArrayList<>(trackIds.size());

        for (int i = 0; i < trackIds.size(); i++) {
            Long trackId = trackIds.get(i);
            int index = i + 1;
            results.add(isolated(trackId, Outcome.SEARCH_ERROR,
                    () -> reconcileTrack(batch, index, trackId, mode)));
        }

        return finish(batch, results);
    }

    public CandidateSearchResult searchCandidatesForBatch(List<Long> trackIds) {
        requireTrackIds(trackIds);

        log.info("Searching catalog candidates for {} tracks", trackIds.size());
        Batch batch = newBatch(trackIds.size());
        List<TrackCandidateSet> sets = new ArrayList<>(trackIds.size());

        for (int i = 0; i < trackIds.size(); i++) {
            sets.add(searchTrack(batch, i + 1, trackIds.get(i)));
        }

        publish(batch.total(), batch.total(), "", ProgressPhase.COMPLETE);
        selectionCoordinator.register(sets);

        CandidateSearchResult result = CandidateSearchResult.of(sets);
        log.info("Candidate search finished: {} with candidates, {} without",
                result.withCandidates(), result.withoutCandidates());
        return result;
    }

    public BatchResult applySelections(List<TrackSelection> selections) {
        if (selections == null || selections.isEmpty()) {
            throw new InvalidInputException("No track selections supplied");
        }

        List<PlannedSelection> plan = selectionCoordinator.resolve(selections);
        if (plan.isEmpty()) {
            throw new InvalidInputException("No valid track selections supplied");
        }

        log.info("Applying {} manual selections", plan.size());
        Batch batch = newBatch(plan.size());
        List<ReconciliationResult> results = new ArrayList<>(plan.size());

        for (int i = 0; i < plan.size(); i++) {
            TrackSelection selection = plan.get(i).selection();
            int index = i + 1;
            results.add(isolated(selection.localTrackId(), Outcome.APPLY_ERROR,
                    () -> applySelection(batch, index, selection)));
        }

        return finish(batch, results);
    }

    private ReconciliationResult reconcileTrack(Batch batch, int index, Long trackId, ReconciliationMode mode) {
        LocalTrackRef track;
        try {
            track = trackStore.getTrack(trackId);
        } catch (ReconciliationException e) {
            log.warn("Track {} could not be loaded: {}", trackId, e.getMessage());
            return ReconciliationResult.failure(trackId, Outcome.SEARCH_ERROR, "track not found: " + trackId);
        }

        transition(track, TrackState.PENDING, TrackState.SEARCHING);
        publish(index, batch.total(), track.title(), ProgressPhase.SEARCHING);

        List<CatalogCandidate> candidates;
        try {
            candidates = search(batch, track);
        } catch (ReconciliationException e) {
            transition(track, TrackState.SEARCHING, TrackState.SEARCH_ERROR);
            log.warn("Catalog search failed for track {}: {}", trackId, e.getMessage());
            return ReconciliationResult.failure(trackId, Outcome.SEARCH_ERROR, e.getMessage());
        }

        if (candidates.isEmpty()) {
            transition(track, TrackState.SEARCHING, TrackState.NO_MATCH);
            return ReconciliationResult.failure(trackId, Outcome.NO_MATCH,
                    "No catalog match for: " + describe(track));
        }

        CatalogCandidate best = candidates.get(0);
        transition(track, TrackState.SEARCHING, TrackState.FOUND);
        log.info("Best match for track {} ({}): catalog track {} '{}' by {}, score {}",
                trackId, describe(track), best.catalogId(), best.title(), best.artistsJoined(),
                String.format("%.2f", best.similarityScore()));

        return apply(batch, index, track, best.catalogId(), mode, TrackState.FOUND);
    }

    private TrackCandidateSet searchTrack(Batch batch, int index, Long trackId) {
        LocalTrackRef track;
        try {
            track = trackStore.getTrack(trackId);
        } catch (ReconciliationException e) {
            log.warn("Track {} could not be loaded: {}", trackId, e.getMessage());
            return TrackCandidateSet.unknownTrack(trackId, "track not found: " + trackId);
        }

        transition(track, TrackState.PENDING, TrackState.SEARCHING);
        publish(index, batch.total(), track.title(), ProgressPhase.SEARCHING);

        try {
            List<CatalogCandidate> candidates = search(batch, track);
            transition(track, TrackState.SEARCHING,
                    candidates.isEmpty() ? TrackState.NO_MATCH : TrackState.MANUAL_SELECTION);
            return TrackCandidateSet.withCandidates(track, candidates);
        } catch (ReconciliationException e) {
            transition(track, TrackState.SEARCHING, TrackState.SEARCH_ERROR);
            log.warn("Catalog search failed for track {}: {}", trackId, e.getMessage());
            return TrackCandidateSet.withError(track, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error searching track {}", trackId, e);
            return TrackCandidateSet.withError(track, String.valueOf(e.getMessage()));
        }
    }

    private ReconciliationResult applySelection(Batch batch, int index, TrackSelection selection) {
        Long trackId = selection.localTrackId();
        if (selection.chosen().isEmpty()) {
            log.info("Track {} marked as not in catalog, skipping", trackId);
            return ReconciliationResult.notSelected(trackId);
        }

        LocalTrackRef track;
        try {
            track = trackStore.getTrack(trackId);
        } catch (ReconciliationException e) {
            log.warn("Track {} could not be loaded: {}", trackId, e.getMessage());
            return ReconciliationResult.failure(trackId, selection.chosenCatalogId(), Outcome.APPLY_ERROR,
                    "track not found: " + trackId);
        }

        return apply(batch, index, track, selection.chosenCatalogId(), ReconciliationMode.MANUAL,
                TrackState.MANUAL_SELECTION);
    }

    private ReconciliationResult apply(Batch batch, int index, LocalTrackRef track, long catalogId,
                                       ReconciliationMode mode, TrackState from) {
        Long trackId = track.id();
        transition(track, from, TrackState.APPLYING);
        publish(index, batch.total(), track.title(), ProgressPhase.DOWNLOADING);

        FullCatalogTags details;
        try {
            pause(batch);
            details = catalog.getTrackDetails(catalogId);
        } catch (ReconciliationException e) {
            return applyFailure(track, catalogId, "Failed to fetch catalog track " + catalogId + ": " + e.getMessage());
        }

        boolean alreadyReconciled = track.hasCatalogId(catalogId);
        MergedTagSet merged = mode.project(mergeEngine.merge(track, details, alreadyReconciled));

        if (mode.requiresArtwork() && isBlank(details.artworkUrl())) {
            return applyFailure(track, catalogId, "no artwork available");
        }

        byte[] artwork = null;
        String warning = null;
        if (merged.artworkUrl() != null) {
            try {
                pause(batch);
                artwork = catalog.downloadArtwork(merged.artworkUrl());
            } catch (ReconciliationException e) {
                if (mode.requiresArtwork()) {
                    return applyFailure(track, catalogId, "Failed to download artwork: " + e.getMessage());
                }
                log.warn("Artwork download failed for track {}, continuing without it: {}", trackId, e.getMessage());
                warning = "artwork not embedded: " + e.getMessage();
                merged = merged.toBuilder().artworkUrl(null).build();
            }
        }

        if (mergeEngine.isNoOp(merged, alreadyReconciled)) {
            transition(track, TrackState.APPLYING, TrackState.APPLIED);
            log.info("Track {} already matches catalog track {}, nothing to write", trackId, catalogId);
            ReconciliationResult unchanged = ReconciliationResult.unchanged(trackId, catalogId);
            return warning != null ? unchanged.withWarning(warning) : unchanged;
        }

        publish(index, batch.total(), track.title(), ProgressPhase.APPLYING_TAGS);

        if (!merged.isEmpty()) {
            try {
                tagWriter.writeTags(resolveAudioFile(track), merged, artwork);
            } catch (TagWriteException e) {
                log.error("Failed to write tags for track {}: {}", trackId, e.getMessage());
                return applyFailure(track, catalogId, e.getMessage());
            }
        }

        ReconciliationResult result = merged.isEmpty()
                ? ReconciliationResult.unchanged(trackId, catalogId)
                : ReconciliationResult.applied(trackId, catalogId, merged);

        try {
            trackStore.updateTrackFields(trackId, merged, catalogId);
        } catch (RuntimeException e) {
            // file already rewritten: a store failure is only a warning
            log.error("Tags written for track {} but the library record was not updated", trackId, e);
            warning = "file updated but library record not updated: " + e.getMessage();
        }

        transition(track, TrackState.APPLYING, TrackState.APPLIED);
        log.info("Applied catalog track {} to track {}: {}", catalogId, trackId, merged.changedFields());
        return warning != null ? result.withWarning(warning) : result;
    }

    private List<CatalogCandidate> search(Batch batch, LocalTrackRef track) {
        pause(batch);
        return catalog.searchCandidates(track.title(), track.artist(), track.durationSeconds(),
                config.getMaxResults(), config.getMinScore());
    }

    private void pause(Batch batch) {
        try {
            batch.throttle().awaitTurn();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CatalogUnavailableException("Interrupted while waiting to contact the catalog", e);
        }
    }

    private ReconciliationResult isolated(Long trackId, Outcome outcome, Supplier<ReconciliationResult> work) {
        try {
            return work.get();
        } catch (RuntimeException e) {
            log.error("Unexpected error reconciling track {}", trackId, e);
            return ReconciliationResult.failure(trackId, outcome, String.valueOf(e.getMessage()));
        }
    }

    private ReconciliationResult applyFailure(LocalTrackRef track, long catalogId, String error) {
        transition(track, TrackState.APPLYING, TrackState.APPLY_ERROR);
        log.warn("Could not apply catalog track {} to track {}: {}", catalogId, track.id(), error);
        return ReconciliationResult.failure(track.id(), catalogId, Outcome.APPLY_ERROR, error);
    }

    private Path resolveAudioFile(LocalTrackRef track) {
        if (isBlank(track.path())) {
            throw new TagWriteException("Track " + track.id() + " has no file path");
        }
        return Paths.get(pathMappingService.mapPath(track.path()));
    }

    private BatchResult finish(Batch batch, List<ReconciliationResult> results) {
        publish(batch.total(), batch.total(), "", ProgressPhase.COMPLETE);
        BatchResult result = BatchResult.of(results);
        log.info("Reconciliation finished: {} of {} tracks succeeded, {} failed",
                result.successCount(), result.total(), result.failedCount());
        return result;
    }

    private void publish(int index, int total, String title, ProgressPhase phase) {
        try {
            progressNotifier.notify(new ProgressEvent(index, total, title != null ? title : "", phase));
        } catch (RuntimeException e) {
            log.debug("Progress notification for phase {} dropped: {}", phase, e.getMessage());
        }
    }

    private void transition(LocalTrackRef track, TrackState from, TrackState to) {
        log.debug("Track {}: {} -> {}", track.id(), from, to);
    }

    private Batch newBatch(int total) {
        return new Batch(total, new RequestThrottle(config.getRequestDelayMs(), sleeper));
    }

    private void requireTrackIds(List<Long> trackIds) {
        if (trackIds == null || trackIds.isEmpty()) {
            throw new InvalidInputException("No track ids supplied");
        }
    }

    private static String describe(LocalTrackRef track) {
        return (track.artist() != null ? track.artist() : "?") + " - " + (track.title() != null ? track.title() : "?");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record Batch(int total, RequestThrottle throttle) {
    }
}
