package com.sashkomusic.catalogreconciler.domain.model;

import java.util.List;

public record TrackCandidateSet(
        Long localTrackId,
        String localTitle,
        String localArtist,
        String localFilename,
        Double localDurationSeconds,
        List<CatalogCandidate> candidates,
        String searchError
) {
    public TrackCandidateSet {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    public static TrackCandidateSet withCandidates(LocalTrackRef track, List<CatalogCandidate> candidates) {
        return new TrackCandidateSet(track.id(), track.title(), track.artist(), track.filename(),
                track.durationSeconds(), candidates, null);
    }

    public static TrackCandidateSet withError(LocalTrackRef track, String error) {
        return new TrackCandidateSet(track.id(), track.title(), track.artist(), track.filename(),
                track.durationSeconds(), List.of(), error);
    }

    public static TrackCandidateSet unknownTrack(Long localTrackId, String error) {
        return new TrackCandidateSet(localTrackId, "", "", null, null, List.of(), error);
    }

    public boolean hasCandidates() {
        return !candidates.isEmpty();
    }

    public boolean offers(long catalogId) {
        return candidates.stream().anyMatch(c -> c.catalogId() == catalogId);
    }
}
