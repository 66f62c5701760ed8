package com.sashkomusic.catalogreconciler.domain.port;

import com.sashkomusic.catalogreconciler.domain.model.LocalTrackRef;
import com.sashkomusic.catalogreconciler.domain.model.MergedTagSet;

public interface LocalTrackStore {

    /**
     * @throws com.sashkomusic.catalogreconciler.domain.exception.InvalidInputException for an unknown id
     */
    LocalTrackRef getTrack(Long id);

    /**
     * Writes only the populated fields of {@code tags}, plus the catalog id when given.
     * Nothing to write is a no-op.
     *
     * @throws com.sashkomusic.catalogreconciler.domain.exception.StoreException when the record cannot be updated,
     *                                                                          including when it no longer exists
     */
    void updateTrackFields(Long id, MergedTagSet tags, Long catalogId);
}
