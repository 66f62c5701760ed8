package com.sashkomusic.catalogreconciler.infrastructure.client.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.sashkomusic.catalogreconciler.config.CatalogConfig;
import com.sashkomusic.catalogreconciler.domain.model.CatalogCandidate;
import com.sashkomusic.catalogreconciler.domain.model.FullCatalogTags;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps catalog track JSON onto domain records. Scraped search results and the v4 API use slightly
 * different field names ({@code track_name} vs {@code name}, {@code key_name} vs a {@code key}
 * object, ...), so every lookup accepts both.
 */
@Component
@RequiredArgsConstructor
public class CatalogTrackMapper {

    private static final String ORIGINAL_MIX = "Original Mix";

    private final CatalogConfig config;

    public Optional<CatalogCandidate> toCandidate(JsonNode track) {
        Long id = longValue(track, "id", "track_id");
        if (id == null) {
            return Optional.empty();
        }

        return Optional.of(new CatalogCandidate(
                id,
                text(track, "name", "track_name"),
                text(track, "mix_name"),
                artistNames(track),
                number(track, "bpm"),
                keyName(track),
                durationSeconds(track),
                artworkUrl(track, config.getThumbnailSize()),
                genreName(track),
                labelName(track),
                releaseDate(track),
                0.0
        ));
    }

    public FullCatalogTags toFullTags(JsonNode track, long catalogId) {
        List<String> artists = artistNames(track);
        JsonNode release = track.path("release");

        return new FullCatalogTags(
                catalogId,
                titleWithMix(text(track, "name", "track_name"), text(track, "mix_name")),
                artists.isEmpty() ? null : String.join(", ", artists),
                number(track, "bpm"),
                keyName(track),
                genreName(track),
                labelName(track),
                text(release, "name", "release_name"),
                year(releaseDate(track)),
                text(track, "isrc"),
                text(track, "catalog_number"),
                artworkUrl(track, config.getArtworkSize())
        );
    }

    String titleWithMix(String name, String mixName) {
        if (name == null) {
            return null;
        }
        if (mixName == null || mixName.equalsIgnoreCase(ORIGINAL_MIX)) {
            return name;
        }
        return name + " (" + mixName + ")";
    }

    Double durationSeconds(JsonNode track) {
        JsonNode lengthMs = track.path("length_ms");
        if (lengthMs.isNumber()) {
            return lengthMs.asDouble() / 1000.0;
        }

        JsonNode length = track.path("length");
        if (length.isNumber()) {
            double value = length.asDouble();
            // bare numbers above ten thousand can only be milliseconds
            return value > 10_000 ? value / 1000.0 : value;
        }
        if (length.isTextual()) {
            return parseClockDuration(length.asText());
        }
        return null;
    }

    String artworkUrl(JsonNode track, int size) {
        JsonNode release = track.path("release");

        String url = imageUrl(release.path("image"), size);
        if (url == null) url = sized(text(release, "image_dynamic_uri", "release_image_dynamic_uri"), size);
        if (url == null) url = text(release, "image_uri", "release_image_uri");
        if (url == null) url = imageUrl(track.path("image"), size);
        if (url == null) url = sized(text(track, "track_image_dynamic_uri"), size);
        if (url == null) url = text(track, "track_image_uri");
        return url;
    }

    private List<String> artistNames(JsonNode track) {
        List<String> names = new ArrayList<>();
        for (JsonNode artist : track.path("artists")) {
            String name = text(artist, "name", "artist_name");
            if (name != null) {
                names.add(name);
            }
        }
        return names;
    }

    private String keyName(JsonNode track) {
        JsonNode key = track.path("key");
        if (key.isObject()) {
            String name = text(key, "name");
            if (name != null) {
                return name;
            }
        }
        return text(track, "key_name");
    }

    private String genreName(JsonNode track) {
        JsonNode genre = track.path("genre");
        if (genre.isArray()) {
            genre = genre.path(0);
        }
        return genre.isObject() ? text(genre, "name", "genre_name") : null;
    }

    private String labelName(JsonNode track) {
        JsonNode label = track.path("label");
        if (!label.isObject()) {
            label = track.path("release").path("label");
        }
        return label.isObject() ? text(label, "name", "label_name") : null;
    }

    private String releaseDate(JsonNode track) {
        String date = text(track, "publish_date");
        return date != null ? date : text(track, "new_release_date");
    }

    private Integer year(String date) {
        if (date == null) {
            return null;
        }
        String prefix = date.split("-", 2)[0];
        try {
            return Integer.parseInt(prefix);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String imageUrl(JsonNode image, int size) {
        if (!image.isObject()) {
            return null;
        }
        String dynamic = sized(text(image, "dynamic_uri"), size);
        return dynamic != null ? dynamic : text(image, "uri");
    }

    private String sized(String dynamicUri, int size) {
        if (dynamicUri == null) {
            return null;
        }
        String value = String.valueOf(size);
        return dynamicUri.replace("{w}", value).replace("{h}", value);
    }

    private Double parseClockDuration(String value) {
        String[] parts = value.trim().split(":");
        if (parts.length < 2 || parts.length > 3) {
            return null;
        }
        try {
            double seconds = 0;
            for (String part : parts) {
                seconds = seconds * 60 + Integer.parseInt(part.trim());
            }
            return seconds;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String text(JsonNode node, String... fieldNames) {
        for (String fieldName : fieldNames) {
            JsonNode value = node.path(fieldName);
            if (value.isTextual() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }

    private static Double number(JsonNode node, String fieldName) {
        JsonNode value = node.path(fieldName);
        return value.isNumber() ? value.asDouble() : null;
    }

    private static Long longValue(JsonNode node, String... fieldNames) {
        for (String fieldName : fieldNames) {
            JsonNode value = node.path(fieldName);
            if (value.canConvertToLong()) {
                return value.asLong();
            }
        }
        return null;
    }
}
