package com.sashkomusic.catalogreconciler.infrastructure.client.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sashkomusic.catalogreconciler.domain.exception.CatalogUnavailableException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the embedded Next.js state ({@code <script id="__NEXT_DATA__">}) out of a catalog web page.
 */
@Component
@RequiredArgsConstructor
public class NextDataExtractor {

    private static final Pattern NEXT_DATA_SCRIPT = Pattern.compile(
            "<script[^>]*\\bid=[\"']__NEXT_DATA__[\"'][^>]*>(.*?)</script>",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;

    public JsonNode extract(String html) {
        if (html == null || html.isEmpty()) {
            throw new CatalogUnavailableException("Empty page returned by catalog");
        }

        Matcher matcher = NEXT_DATA_SCRIPT.matcher(html);
        if (!matcher.find()) {
            throw new CatalogUnavailableException("No __NEXT_DATA__ script found in catalog page");
        }

        try {
            return objectMapper.readTree(matcher.group(1).trim());
        } catch (JsonProcessingException e) {
            throw new CatalogUnavailableException("Could not parse __NEXT_DATA__: " + e.getOriginalMessage(), e);
        }
    }
}
