package com.sashkomusic.catalogreconciler.infrastructure.client.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.sashkomusic.catalogreconciler.config.CatalogConfig;
import com.sashkomusic.catalogreconciler.domain.exception.CatalogUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Anonymous API token taken from the public search page session. Cached until shortly before it
 * expires.
 */
@Slf4j
@Component
public class CatalogTokenProvider {

    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final RestClient restClient;
    private final CatalogConfig config;
    private final NextDataExtractor nextDataExtractor;
    private final Clock clock;

    private String accessToken;
    private Instant refreshAfter = Instant.MIN;

    @Autowired
    public CatalogTokenProvider(RestClient.Builder restClientBuilder, CatalogConfig config,
                                NextDataExtractor nextDataExtractor) {
        this(restClientBuilder.build(), config, nextDataExtractor, Clock.systemUTC());
    }

    CatalogTokenProvider(RestClient restClient, CatalogConfig config, NextDataExtractor nextDataExtractor, Clock clock) {
        this.restClient = restClient;
        this.config = config;
        this.nextDataExtractor = nextDataExtractor;
        this.clock = clock;
    }

    public synchronized String getToken() {
        if (accessToken != null && clock.instant().isBefore(refreshAfter)) {
            return accessToken;
        }

        log.debug("Requesting new anonymous catalog token");
        JsonNode session = nextDataExtractor.extract(fetchSessionPage()).at("/props/pageProps/anonSession");

        JsonNode token = session.path("access_token");
        if (!token.isTextual() || token.asText().isBlank()) {
            throw new CatalogUnavailableException("access_token not found in catalog page");
        }
        long expiresIn = session.path("expires_in").canConvertToLong()
                ? session.path("expires_in").asLong()
                : DEFAULT_EXPIRES_IN_SECONDS;

        accessToken = token.asText();
        refreshAfter = clock.instant().plus(Duration.ofSeconds(expiresIn - config.getTokenExpiryMarginSeconds()));
        log.info("Obtained catalog token, valid for {}s", expiresIn);
        return accessToken;
    }

    public synchronized void invalidate() {
        accessToken = null;
        refreshAfter = Instant.MIN;
    }

    private String fetchSessionPage() {
        URI uri = UriComponentsBuilder.fromUriString(config.getSearchUrl())
                .queryParam("q", "test")
                .build()
                .toUri();
        try {
            return restClient.get()
                    .uri(uri)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        throw new CatalogUnavailableException("Catalog session page returned HTTP "
                                + response.getStatusCode().value());
                    })
                    .body(String.class);
        } catch (RestClientException e) {
            throw new CatalogUnavailableException("Failed to fetch catalog session: " + e.getMessage(), e);
        }
    }
}
