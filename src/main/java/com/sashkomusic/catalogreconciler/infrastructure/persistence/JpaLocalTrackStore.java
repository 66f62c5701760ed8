package com.sashkomusic.catalogreconciler.infrastructure.persistence;

import com.sashkomusic.catalogreconciler.domain.entity.Track;
import com.sashkomusic.catalogreconciler.domain.exception.InvalidInputException;
import com.sashkomusic.catalogreconciler.domain.exception.StoreException;
import com.sashkomusic.catalogreconciler.domain.model.LocalTrackRef;
import com.sashkomusic.catalogreconciler.domain.model.MergedTagSet;
import com.sashkomusic.catalogreconciler.domain.port.LocalTrackStore;
import com.sashkomusic.catalogreconciler.domain.repository.TrackRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaLocalTrackStore implements LocalTrackStore {

    private final TrackRepository trackRepository;

    @Override
    @Transactional(readOnly = true)
    public LocalTrackRef getTrack(Long id) {
        if (id == null) {
            throw new InvalidInputException("Track id must not be null");
        }
        try {
            return trackRepository.findById(id)
                    .map(this::toRef)
                    .orElseThrow(() -> new InvalidInputException("track not found: " + id));
        } catch (DataAccessException e) {
            throw new StoreException("Failed to load track " + id, e);
        }
    }

    @Override
    @Transactional
    public void updateTrackFields(Long id, MergedTagSet tags, Long catalogId) {
        if (tags.isEmpty() && catalogId == null) {
            return;
        }

        try {
            Track track = trackRepository.findById(id)
                    .orElseThrow(() -> new StoreException("track " + id + " no longer exists"));

            if (tags.title() != null) track.setTitle(tags.title());
            if (tags.artist() != null) track.setArtist(tags.artist());
            if (tags.bpm() != null) track.setBpm(tags.bpm());
            if (tags.key() != null) track.setMusicalKey(tags.key());
            if (tags.genre() != null) track.setGenre(tags.genre());
            if (tags.label() != null) track.setLabel(tags.label());
            if (tags.album() != null) track.setAlbum(tags.album());
            if (tags.year() != null) track.setYear(tags.year());
            if (tags.isrc() != null) track.setIsrc(tags.isrc());
            if (tags.catalogNumber() != null) track.setCatalogNumber(tags.catalogNumber());
            if (tags.artworkUrl() != null) track.setArtworkUrl(tags.artworkUrl());
            if (catalogId != null) {
                track.setCatalogId(catalogId);
                track.setReconciledAt(LocalDateTime.now());
            }

            trackRepository.saveAndFlush(track);
            log.debug("Updated track {} in library: {}", id, tags.changedFields());
        } catch (DataAccessException e) {
            throw new StoreException("Failed to update track " + id, e);
        }
    }

    private LocalTrackRef toRef(Track track) {
        return new LocalTrackRef(
                track.getId(),
                track.getLocalPath(),
                track.getTitle(),
                track.getArtist(),
                track.getDuration(),
                track.getBpm(),
                track.getMusicalKey(),
                track.getGenre(),
                track.getAlbum(),
                track.getYear(),
                track.getLabel(),
                track.getIsrc(),
                track.getCatalogNumber(),
                track.getArtworkUrl(),
                track.getCatalogId()
        );
    }
}
