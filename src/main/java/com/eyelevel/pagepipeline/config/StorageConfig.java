package com.eyelevel.pagepipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds properties under "app.storage". {@code type} selects the blob store implementation
 * ({@code local} or {@code s3}); {@code local.media-root} also resolves relative source file
 * references of documents.
 */
@Data
@ConfigurationProperties(prefix = "app.storage")
public class StorageConfig {

    private String type = "local";
    private Local local = new Local();

    @Data
    public static class Local {
        private String mediaRoot = "media";
        private String baseUrl = "/media/";
    }
}
