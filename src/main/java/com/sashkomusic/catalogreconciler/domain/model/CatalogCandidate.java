package com.sashkomusic.catalogreconciler.domain.model;

import java.util.List;

public record CatalogCandidate(
        long catalogId,
        String title,
        String mixName,
        List<String> artists,
        Double bpm,
        String key,
        Double durationSeconds,
        String artworkUrl,
        String genre,
        String label,
        String releaseDate,
        double similarityScore
) {
    public CatalogCandidate {
        artists = artists != null ? List.copyOf(artists) : List.of();
    }

    public CatalogCandidate withScore(double score) {
        return new CatalogCandidate(catalogId, title, mixName, artists, bpm, key, durationSeconds,
                artworkUrl, genre, label, releaseDate, score);
    }

    public String artistsJoined() {
        return String.join(", ", artists);
    }
}
