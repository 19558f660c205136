package com.eyelevel.pagepipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds properties under "app.rendering". The backend list is a priority order: the first
 * backend that is installed and renders a page wins.
 *
 * <pre>
 * app:
 *   rendering:
 *     backends: poppler, mupdf, ghostscript, pdfbox
 *     cli-timeout-seconds: 120
 *     temp-dir: /var/tmp/page-pipeline-render
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "app.rendering")
public class RenderingConfig {

    private List<String> backends = new ArrayList<>(List.of("poppler", "mupdf", "pdfbox"));
    private long cliTimeoutSeconds = 120;
    private long probeTimeoutSeconds = 10;

    /**
     * Root of the per-render working directories of the command-line backends. Entries left
     * behind by a crash are removed by the temp file cleanup.
     */
    private String tempDir = Paths.get(System.getProperty("java.io.tmpdir"), "page-pipeline-render").toString();
}
