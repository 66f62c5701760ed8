package com.sashkomusic.catalogreconciler.infrastructure.client.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sashkomusic.catalogreconciler.config.CatalogConfig;
import com.sashkomusic.catalogreconciler.domain.model.FullCatalogTags;
import org.junit.jupiter.api.Test;

class CatalogTrackMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CatalogTrackMapper mapper = new CatalogTrackMapper(new CatalogConfig());

    @Test
    void durationPrefersMillisecondsField() throws Exception {
        assertEquals(635.0, mapper.durationSeconds(json("{\"length_ms\":635000,\"length\":\"1:00\"}")));
    }

    @Test
    void durationFallsBackToLengthField() throws Exception {
        assertEquals(637.0, mapper.durationSeconds(json("{\"length\":\"10:37\"}")));
        assertEquals(3723.0, mapper.durationSeconds(json("{\"length\":\"1:02:03\"}")));
        assertEquals(420.0, mapper.durationSeconds(json("{\"length\":420000}")));
        assertEquals(420.0, mapper.durationSeconds(json("{\"length\":420}")));
        assertNull(mapper.durationSeconds(json("{\"length\":\"unknown\"}")));
        assertNull(mapper.durationSeconds(json("{}")));
    }

    @Test
    void originalMixIsNotAppendedToTitle() {
        assertEquals("Strobe", mapper.titleWithMix("Strobe", "Original Mix"));
        assertEquals("Strobe", mapper.titleWithMix("Strobe", null));
        assertEquals("Strobe (Club Edit)", mapper.titleWithMix("Strobe", "Club Edit"));
    }

    @Test
    void artworkLookupOrderIsReleaseThenTrackImage() throws Exception {
        JsonNode trackImageOnly = json("{\"image\":{\"id\":1,\"uri\":\"https://img/x.jpg\",\"dynamic_uri\":\"https://img/{w}x{h}/x.jpg\"}}");
        JsonNode both = json("{\"release\":{\"image\":{\"id\":2,\"uri\":\"https://img/r.jpg\"}},"
                + "\"image\":{\"id\":1,\"uri\":\"https://img/x.jpg\"}}");

        assertEquals("https://img/250x250/x.jpg", mapper.artworkUrl(trackImageOnly, 250));
        assertEquals("https://img/r.jpg", mapper.artworkUrl(both, 500));
        assertNull(mapper.artworkUrl(json("{}"), 500));
    }

    @Test
    void multipleArtistsAreJoined() throws Exception {
        FullCatalogTags tags = mapper.toFullTags(json("{\"name\":\"Ghosts 'n' Stuff\",\"mix_name\":\"Original Mix\","
                + "\"artists\":[{\"name\":\"deadmau5\"},{\"name\":\"Rob Swire\"}],\"publish_date\":\"bad-date\"}"), 7L);

        assertEquals("deadmau5, Rob Swire", tags.artist());
        assertNull(tags.year());
        assertNull(tags.bpm());
    }

    @Test
    void searchResultWithoutIdIsSkipped() throws Exception {
        assertTrue(mapper.toCandidate(json("{\"track_name\":\"No id\"}")).isEmpty());
    }

    private JsonNode json(String value) throws Exception {
        return objectMapper.readTree(value);
    }
}
