package com.sashkomusic.catalogreconciler.domain.model;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Read-only snapshot of a local track as stored in the library, taken at the start of a batch.
 * Optional values are {@code null} when the library has nothing for them.
 */
public record LocalTrackRef(
        Long id,
        String path,
        String title,
        String artist,
        Double durationSeconds,
        Double currentBpm,
        String currentKey,
        String currentGenre,
        String currentAlbum,
        Integer currentYear,
        String currentLabel,
        String currentIsrc,
        String currentCatalogNumber,
        String currentArtworkUrl,
        Long catalogId
) {

    public String filename() {
        if (path == null || path.isBlank()) {
            return null;
        }
        Path fileName = Paths.get(path).getFileName();
        return fileName != null ? fileName.toString() : null;
    }

    public boolean hasCatalogId(long candidateId) {
        return catalogId != null && catalogId == candidateId;
    }
}
