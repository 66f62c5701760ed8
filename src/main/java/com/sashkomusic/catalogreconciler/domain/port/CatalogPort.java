package com.sashkomusic.catalogreconciler.domain.port;

import com.sashkomusic.catalogreconciler.domain.model.CatalogCandidate;
import com.sashkomusic.catalogreconciler.domain.model.FullCatalogTags;

import java.util.List;

public interface CatalogPort {

    /**
     * Searches the catalog by title and artist and returns at most {@code maxResults} candidates
     * scoring at least {@code minScore}, best first.
     *
     * @throws com.sashkomusic.catalogreconciler.domain.exception.CatalogUnavailableException on
     *         network or protocol failure
     */
    List<CatalogCandidate> searchCandidates(String title, String artist, Double durationHintSeconds,
                                            int maxResults, double minScore);

    /**
     * @throws com.sashkomusic.catalogreconciler.domain.exception.CatalogNotFoundException if the id
     *         no longer resolves
     */
    FullCatalogTags getTrackDetails(long catalogId);

    byte[] downloadArtwork(String artworkUrl);
}
