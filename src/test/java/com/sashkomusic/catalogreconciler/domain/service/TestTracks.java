package com.sashkomusic.catalogreconciler.domain.service;

import com.sashkomusic.catalogreconciler.domain.model.CatalogCandidate;
import com.sashkomusic.catalogreconciler.domain.model.FullCatalogTags;
import com.sashkomusic.catalogreconciler.domain.model.LocalTrackRef;
import com.sashkomusic.catalogreconciler.domain.model.MergedTagSet;
import java.util.List;

final class TestTracks {

    private TestTracks() {
    }

    static LocalTrackRef track(Long id, String title, String artist, Double bpm) {
        return new LocalTrackRef(id, "/music/" + artist + " - " + title + ".mp3", title, artist, 300.0,
                bpm, null, null, null, null, null, null, null, null, null);
    }

    static FullCatalogTags catalogTags(long catalogId, String title, String artist, Double bpm) {
        return new FullCatalogTags(catalogId, title, artist, bpm, "A Minor", "Progressive House", "mau5trap",
                "For Lack of a Better Name", 2009, "USUS10900001", "CAT001", null);
    }

    static CatalogCandidate candidate(long catalogId, String title, String artist) {
        return new CatalogCandidate(catalogId, title, "Original Mix", List.of(artist), 128.0, "A Minor", 300.0,
                null, "Progressive House", "mau5trap", "2009-09-22", 0.95);
    }

    static LocalTrackRef applied(LocalTrackRef track, MergedTagSet tags, Long catalogId) {
        return new LocalTrackRef(
                track.id(),
                track.path(),
                tags.title() != null ? tags.title() : track.title(),
                tags.artist() != null ? tags.artist() : track.artist(),
                track.durationSeconds(),
                tags.bpm() != null ? tags.bpm() : track.currentBpm(),
                tags.key() != null ? tags.key() : track.currentKey(),
                tags.genre() != null ? tags.genre() : track.currentGenre(),
                tags.album() != null ? tags.album() : track.currentAlbum(),
                tags.year() != null ? tags.year() : track.currentYear(),
                tags.label() != null ? tags.label() : track.currentLabel(),
                tags.isrc() != null ? tags.isrc() : track.currentIsrc(),
                tags.catalogNumber() != null ? tags.catalogNumber() : track.currentCatalogNumber(),
                tags.artworkUrl() != null ? tags.artworkUrl() : track.currentArtworkUrl(),
                catalogId != null ? catalogId : track.catalogId());
    }
}
