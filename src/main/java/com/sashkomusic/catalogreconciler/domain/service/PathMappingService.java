package com.sashkomusic.catalogreconciler.domain.service;

import com.sashkomusic.catalogreconciler.config.PathMappingConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Rewrites stored track paths when the library was indexed on another host or mount point.
 */
@Service
@RequiredArgsConstructor
public class PathMappingService {

    private final PathMappingConfig pathMappingConfig;

    public String mapPath(String originalPath) {
        if (!pathMappingConfig.isEnabled() || originalPath == null) {
            return originalPath;
        }

        String source = pathMappingConfig.getSource();
        String target = pathMappingConfig.getTarget();

        if (source == null || target == null || source.isEmpty() || target.isEmpty()) {
            return originalPath;
        }

        if (originalPath.startsWith(source)) {
            return target + originalPath.substring(source.length());
        }

        return originalPath;
    }
}
