package com.sashkomusic.catalogreconciler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "catalog")
public class CatalogConfig {

    private String searchUrl = "https://www.beatport.com/search/tracks";
    private String apiBaseUrl = "https://api.beatport.com/v4";
    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    private int overfetch = 25;
    private int artworkSize = 500;
    private int thumbnailSize = 100;
    private long tokenExpiryMarginSeconds = 60;
    private int connectTimeoutSeconds = 10;
}
