package com.sashkomusic.catalogreconciler.domain.repository;

import com.sashkomusic.catalogreconciler.domain.entity.Track;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TrackRepository extends JpaRepository<Track, Long> {
}
