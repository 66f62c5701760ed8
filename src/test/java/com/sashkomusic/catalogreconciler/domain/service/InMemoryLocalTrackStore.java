package com.sashkomusic.catalogreconciler.domain.service;

import com.sashkomusic.catalogreconciler.domain.exception.InvalidInputException;
import com.sashkomusic.catalogreconciler.domain.exception.StoreException;
import com.sashkomusic.catalogreconciler.domain.model.LocalTrackRef;
import com.sashkomusic.catalogreconciler.domain.model.MergedTagSet;
import com.sashkomusic.catalogreconciler.domain.port.LocalTrackStore;
import java.util.HashMap;
import java.util.Map;

class InMemoryLocalTrackStore implements LocalTrackStore {

    private final Map<Long, LocalTrackRef> tracks = new HashMap<>();
    private RuntimeException updateFailure;
    private int updateCount;

    void put(LocalTrackRef track) {
        tracks.put(track.id(), track);
    }

    LocalTrackRef get(Long id) {
        return tracks.get(id);
    }

    void failUpdates() {
        failUpdatesWith(new StoreException("database is read-only", new IllegalStateException("read-only")));
    }

    void failUpdatesWith(RuntimeException failure) {
        this.updateFailure = failure;
    }

    int updateCount() {
        return updateCount;
    }

    @Override
    public LocalTrackRef getTrack(Long id) {
        LocalTrackRef track = tracks.get(id);
        if (track == null) {
            throw new InvalidInputException("track not found: " + id);
        }
        return track;
    }

    @Override
    public void updateTrackFields(Long id, MergedTagSet tags, Long catalogId) {
        if (updateFailure != null) {
            throw updateFailure;
        }
        updateCount++;
        tracks.put(id, TestTracks.applied(getTrack(id), tags, catalogId));
    }
}
