package com.eyelevel.pagepipeline.config;

import com.eyelevel.pagepipeline.service.image.ImageFormat;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds application properties under the "app.processing" prefix to a strongly-typed
 * configuration object. Controls how pages are rasterized, encoded and retried.
 */
@Data
@ConfigurationProperties(prefix = "app.processing")
public class DocumentProcessingConfig {

    /**
     * Upper bound for source files in bytes. Zero or negative disables the check.
     */
    private long maxFileSize = 50L * 1024 * 1024;
    private int dpi = 150;
    private PageImage page = new PageImage();
    private Thumbnail thumbnail = new Thumbnail();
    private RetryConfig retry = new RetryConfig();

    @Data
    public static class PageImage {
        private ImageFormat format = ImageFormat.JPEG;
        private int quality = 85;
    }

    @Data
    public static class Thumbnail {
        private int maxWidth = 200;
        private int maxHeight = 280;
        private ImageFormat format = ImageFormat.JPEG;
        private int quality = 70;
    }

    @Data
    public static class RetryConfig {
        private int maxRetries = 3;
        private long delayMs = 60_000;
    }
}
