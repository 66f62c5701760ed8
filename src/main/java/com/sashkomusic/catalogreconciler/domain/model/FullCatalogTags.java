package com.sashkomusic.catalogreconciler.domain.model;

/**
 * Complete tag set for one catalog entry, as returned by the detail endpoint.
 */
public record FullCatalogTags(
        long catalogId,
        String title,
        String artist,
        Double bpm,
        String key,
        String genre,
        String label,
        String album,
        Integer year,
        String isrc,
        String catalogNumber,
        String artworkUrl
) {
}
