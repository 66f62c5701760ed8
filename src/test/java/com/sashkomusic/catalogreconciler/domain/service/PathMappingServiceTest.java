package com.sashkomusic.catalogreconciler.domain.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.sashkomusic.catalogreconciler.config.PathMappingConfig;
import org.junit.jupiter.api.Test;

class PathMappingServiceTest {

    @Test
    void disabledMappingReturnsPathUnchanged() {
        PathMappingService service = new PathMappingService(new PathMappingConfig());

        assertEquals("/music/a.mp3", service.mapPath("/music/a.mp3"));
        assertNull(service.mapPath(null));
    }

    @Test
    void enabledMappingRewritesMatchingPrefixOnly() {
        PathMappingConfig config = new PathMappingConfig();
        config.setEnabled(true);
        config.setSource("/Users/sashko/Music");
        config.setTarget("/mnt/music");
        PathMappingService service = new PathMappingService(config);

        assertEquals("/mnt/music/Techno/a.flac", service.mapPath("/Users/sashko/Music/Techno/a.flac"));
        assertEquals("/other/a.flac", service.mapPath("/other/a.flac"));
    }

    @Test
    void incompleteMappingIsIgnored() {
        PathMappingConfig config = new PathMappingConfig();
        config.setEnabled(true);
        config.setSource("/Users/sashko/Music");
        PathMappingService service = new PathMappingService(config);

        assertEquals("/Users/sashko/Music/a.flac", service.mapPath("/Users/sashko/Music/a.flac"));
    }
}
