package com.sashkomusic.catalogreconciler.infrastructure.client.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sashkomusic.catalogreconciler.config.CatalogConfig;
import com.sashkomusic.catalogreconciler.domain.exception.CatalogNotFoundException;
import com.sashkomusic.catalogreconciler.domain.exception.CatalogUnavailableException;
import com.sashkomusic.catalogreconciler.domain.model.CatalogCandidate;
import com.sashkomusic.catalogreconciler.domain.model.FullCatalogTags;
import com.sashkomusic.catalogreconciler.domain.port.CatalogPort;
import com.sashkomusic.catalogreconciler.domain.service.CandidateScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
public class CatalogClient implements CatalogPort {

    private static final String SEARCH_RESULTS_POINTER = "/props/pageProps/dehydratedState/queries/0/state/data/data";

    private final RestClient restClient;
    private final CatalogConfig config;
    private final CatalogTokenProvider tokenProvider;
    private final NextDataExtractor nextDataExtractor;
    private final CatalogTrackMapper trackMapper;
    private final CandidateScorer scorer;
    private final ObjectMapper objectMapper;

    public CatalogClient(RestClient.Builder restClientBuilder,
                         CatalogConfig config,
                         CatalogTokenProvider tokenProvider,
                         NextDataExtractor nextDataExtractor,
                         CatalogTrackMapper trackMapper,
                         CandidateScorer scorer,
                         ObjectMapper objectMapper) {
        this.restClient = restClientBuilder.build();
        this.config = config;
        this.tokenProvider = tokenProvider;
        this.nextDataExtractor = nextDataExtractor;
        this.trackMapper = trackMapper;
        this.scorer = scorer;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<CatalogCandidate> searchCandidates(String title, String artist, Double durationHintSeconds,
                                                   int maxResults, double minScore) {
        String query = (nullToEmpty(artist) + " " + nullToEmpty(title)).trim();
        if (query.isEmpty()) {
            log.debug("Nothing to search for, track has neither title nor artist");
            return List.of();
        }

        URI uri = UriComponentsBuilder.fromUriString(config.getSearchUrl())
                .queryParam("q", query)
                .encode()
                .build()
                .toUri();

        log.debug("Catalog search: {}", uri);
        String html = fetchSearchPage(uri);

        JsonNode data = nextDataExtractor.extract(html).at(SEARCH_RESULTS_POINTER);
        if (data.isMissingNode()) {
            throw new CatalogUnavailableException("Search results not found in catalog page");
        }
        if (!data.isArray()) {
            log.debug("Catalog search '{}' returned no track list", query);
            return List.of();
        }

        List<CatalogCandidate> parsed = new ArrayList<>();
        for (JsonNode item : data) {
            if (parsed.size() >= config.getOverfetch()) {
                break;
            }
            trackMapper.toCandidate(item).ifPresentOrElse(parsed::add,
                    () -> log.debug("Skipping search result without track id"));
        }

        List<CatalogCandidate> ranked = scorer.rank(title, artist, durationHintSeconds, parsed, minScore, maxResults);
        log.info("Catalog search '{}': {} results, {} candidates above {}", query, parsed.size(), ranked.size(), minScore);
        return ranked;
    }

    @Override
    public FullCatalogTags getTrackDetails(long catalogId) {
        URI uri = UriComponentsBuilder.fromUriString(config.getApiBaseUrl())
                .path("/catalog/tracks/{id}")
                .buildAndExpand(catalogId)
                .toUri();

        String token = tokenProvider.getToken();
        String body;
        try {
            body = restClient.get()
                    .uri(uri)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(status -> status.value() == 404, (request, response) -> {
                        throw new CatalogNotFoundException(catalogId);
                    })
                    .onStatus(status -> status.value() == 401, (request, response) -> {
                        tokenProvider.invalidate();
                        throw new CatalogUnavailableException("Catalog rejected the access token");
                    })
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        throw statusError("track " + catalogId, response.getStatusCode());
                    })
                    .body(String.class);
        } catch (RestClientException e) {
            throw new CatalogUnavailableException("Failed to fetch catalog track " + catalogId + ": " + e.getMessage(), e);
        }

        if (body == null || body.isBlank()) {
            throw new CatalogUnavailableException("Empty response for catalog track " + catalogId);
        }

        try {
            FullCatalogTags tags = trackMapper.toFullTags(objectMapper.readTree(body), catalogId);
            log.debug("Catalog track {}: {}", catalogId, tags);
            return tags;
        } catch (JsonProcessingException e) {
            throw new CatalogUnavailableException("Could not parse catalog track " + catalogId + ": " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public byte[] downloadArtwork(String artworkUrl) {
        if (artworkUrl == null || artworkUrl.isBlank()) {
            throw new CatalogUnavailableException("No artwork URL provided");
        }

        log.info("Downloading artwork from: {}", artworkUrl);
        byte[] imageData;
        try {
            imageData = restClient.get()
                    .uri(URI.create(artworkUrl))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        throw statusError("artwork", response.getStatusCode());
                    })
                    .body(byte[].class);
        } catch (RestClientException | IllegalArgumentException e) {
            throw new CatalogUnavailableException("Failed to download artwork from " + artworkUrl + ": " + e.getMessage(), e);
        }

        if (imageData == null || imageData.length == 0) {
            throw new CatalogUnavailableException("Empty response from artwork URL: " + artworkUrl);
        }
        if (!isValidImageData(imageData)) {
            throw new CatalogUnavailableException("Downloaded artwork is not a JPEG or PNG image (first bytes: "
                    + bytesToHex(imageData, Math.min(8, imageData.length)) + ")");
        }

        log.debug("Artwork downloaded ({} bytes)", imageData.length);
        return imageData;
    }

    private String fetchSearchPage(URI uri) {
        try {
            return restClient.get()
                    .uri(uri)
                    .accept(MediaType.TEXT_HTML)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        throw statusError("search", response.getStatusCode());
                    })
                    .body(String.class);
        } catch (RestClientException e) {
            throw new CatalogUnavailableException("Catalog search request failed: " + e.getMessage(), e);
        }
    }

    private CatalogUnavailableException statusError(String what, HttpStatusCode status) {
        if (status.value() == 429) {
            return new CatalogUnavailableException("Catalog rate limit reached while fetching " + what + " (HTTP 429)");
        }
        return new CatalogUnavailableException("Catalog returned HTTP " + status.value() + " for " + what);
    }

    static boolean isValidImageData(byte[] data) {
        if (data.length < 4) {
            return false;
        }
        // JPEG: FF D8 FF
        if (data[0] == (byte) 0xFF && data[1] == (byte) 0xD8 && data[2] == (byte) 0xFF) {
            return true;
        }
        // PNG: 89 50 4E 47
        return data[0] == (byte) 0x89 && data[1] == (byte) 0x50
                && data[2] == (byte) 0x4E && data[3] == (byte) 0x47;
    }

    private static String bytesToHex(byte[] bytes, int length) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < length; i++) {
            sb.append(String.format("%02X ", bytes[i]));
        }
        return sb.toString().trim();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
