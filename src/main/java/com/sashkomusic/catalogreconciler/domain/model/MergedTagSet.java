package com.sashkomusic.catalogreconciler.domain.model;

import lombok.Builder;

import java.util.ArrayList;
import java.util.List;

/**
 * Tags the merge policy decided to change. Absent ({@code null}) fields must not be written.
 */
@Builder(toBuilder = true)
public record MergedTagSet(
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

    public static MergedTagSet empty() {
        return MergedTagSet.builder().build();
    }

    public boolean isEmpty() {
        return changedFields().isEmpty();
    }

    public MergedTagSet artworkOnly() {
        return MergedTagSet.builder().artworkUrl(artworkUrl).build();
    }

    public List<String> changedFields() {
        List<String> fields = new ArrayList<>();
        if (title != null) fields.add("title");
        if (artist != null) fields.add("artist");
        if (bpm != null) fields.add("bpm");
        if (key != null) fields.add("key");
        if (genre != null) fields.add("genre");
        if (label != null) fields.add("label");
        if (album != null) fields.add("album");
        if (year != null) fields.add("year");
        if (isrc != null) fields.add("isrc");
        if (catalogNumber != null) fields.add("catalogNumber");
        if (artworkUrl != null) fields.add("artworkUrl");
        return fields;
    }
}
