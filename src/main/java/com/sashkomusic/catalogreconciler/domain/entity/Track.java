package com.sashkomusic.catalogreconciler.domain.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "tracks")
@Getter
@Setter
public class Track {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String title;

    @Column
    private String artist;

    @Column
    private String album;

    @Column
    private String genre;

    @Column(name = "release_year")
    private Integer year;

    @Column
    private Double bpm;

    @Column(name = "musical_key")
    private String musicalKey;

    @Column
    private String label;

    @Column(length = 15)
    private String isrc;

    @Column
    private String catalogNumber;

    @Column(length = 1024)
    private String artworkUrl;

    @Column
    private Double duration; // in seconds

    @Column(nullable = false, length = 2048)
    private String localPath;

    @Column
    private Long catalogId;

    @Column
    private LocalDateTime reconciledAt;

    public Track() {
    }

    public Track(String title, String artist, String localPath) {
        this.title = title;
        this.artist = artist;
        this.localPath = localPath;
    }
}
