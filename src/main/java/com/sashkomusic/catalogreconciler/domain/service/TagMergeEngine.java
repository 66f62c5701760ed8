package com.sashkomusic.catalogreconciler.domain.service;

import com.sashkomusic.catalogreconciler.domain.model.FullCatalogTags;
import com.sashkomusic.catalogreconciler.domain.model.LocalTrackRef;
import com.sashkomusic.catalogreconciler.domain.model.MergedTagSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Field-level merge of catalog tags into a local track.
 * <ul>
 *     <li>title, artist, genre, album, year, label, ISRC, key, catalog number and artwork are
 *     overwritten whenever the catalog has a value that differs from the local one</li>
 *     <li>BPM is only filled in when the local track has none; an existing BPM is never replaced</li>
 * </ul>
 * The catalog id is not a tag; the caller records it on the store whenever a match is applied.
 */
@Slf4j
@Service
public class TagMergeEngine {

    public MergedTagSet merge(LocalTrackRef current, FullCatalogTags incoming, boolean alreadyHasCatalogId) {
        MergedTagSet merged = MergedTagSet.builder()
                .title(overwrite(current.title(), incoming.title()))
                .artist(overwrite(current.artist(), incoming.artist()))
                .bpm(fillIfAbsent(current.currentBpm(), incoming.bpm()))
                .key(overwrite(current.currentKey(), incoming.key()))
                .genre(overwrite(current.currentGenre(), incoming.genre()))
                .label(overwrite(current.currentLabel(), incoming.label()))
                .album(overwrite(current.currentAlbum(), incoming.album()))
                .year(overwrite(current.currentYear(), incoming.year()))
                .isrc(overwrite(current.currentIsrc(), incoming.isrc()))
                .catalogNumber(overwrite(current.currentCatalogNumber(), incoming.catalogNumber()))
                .artworkUrl(overwrite(current.currentArtworkUrl(), incoming.artworkUrl()))
                .build();

        if (current.currentBpm() != null && incoming.bpm() != null) {
            log.debug("Preserving existing BPM {} for track {} (catalog has {})",
                    current.currentBpm(), current.id(), incoming.bpm());
        }
        log.debug("Merged catalog track {} into track {}: changed={}, alreadyReconciled={}",
                incoming.catalogId(), current.id(), merged.changedFields(), alreadyHasCatalogId);

        return merged;
    }

    /**
     * True when applying {@code merged} would change neither the file nor the stored record.
     */
    public boolean isNoOp(MergedTagSet merged, boolean alreadyHasCatalogId) {
        return merged.isEmpty() && alreadyHasCatalogId;
    }

    private String overwrite(String current, String incoming) {
        if (incoming == null || incoming.isBlank()) {
            return null;
        }
        String value = incoming.trim();
        if (current != null && current.trim().equals(value)) {
            return null;
        }
        return value;
    }

    private Integer overwrite(Integer current, Integer incoming) {
        if (incoming == null || Objects.equals(current, incoming)) {
            return null;
        }
        return incoming;
    }

    private Double fillIfAbsent(Double current, Double incoming) {
        if (current != null || incoming == null || incoming <= 0) {
            return null;
        }
        return incoming;
    }
}
