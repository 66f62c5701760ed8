package com.sashkomusic.catalogreconciler.domain.model;

import java.util.Optional;

/**
 * User choice for one local track. A {@code null} catalog id means the user confirmed the track
 * is not in the catalog, which is a final answer rather than an undecided one.
 */
public record TrackSelection(
        Long localTrackId,
        Long chosenCatalogId
) {
    public static TrackSelection notInCatalog(Long localTrackId) {
        return new TrackSelection(localTrackId, null);
    }

    public Optional<Long> chosen() {
        return Optional.ofNullable(chosenCatalogId);
    }
}
