package com.eyelevel.pagepipeline.service.render;

import com.eyelevel.pagepipeline.common.processexec.ProcessExecutor;
import com.eyelevel.pagepipeline.config.RenderingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the {@link FallbackRenderChain} from the configured backend names.
 *
 * <h3>Example configuration (application.yml):</h3>
 * <pre>
 * app:
 *   rendering:
 *     backends: poppler, mupdf, ghostscript, pdfbox
 * </pre>
 *
 * <p>Available backends:
 * <ul>
 *   <li>{@code poppler} → {@code pdftoppm}</li>
 *   <li>{@code mupdf} → {@code mutool draw}</li>
 *   <li>{@code ghostscript} → {@code gs}</li>
 *   <li>{@code pdfbox} → {@link PdfBoxRenderBackend}, in-process</li>
 * </ul>
 */
@Configuration
@Slf4j
public class RenderBackendConfig {

    @Bean
    public FallbackRenderChain fallbackRenderChain(RenderingConfig config, ProcessExecutor processExecutor) {
        List<RenderBackend> backends = new ArrayList<>();
        for (String name : config.getBackends()) {
            if (name == null || name.isBlank()) {
                continue;
            }
            RenderBackend backend = switch (name.trim().toLowerCase()) {
                case "poppler" -> cli(CliTool.POPPLER, processExecutor, config);
                case "mupdf" -> cli(CliTool.MUPDF, processExecutor, config);
                case "ghostscript" -> cli(CliTool.GHOSTSCRIPT, processExecutor, config);
                case "pdfbox" -> new PdfBoxRenderBackend();
                default -> {
                    log.error("Unknown render backend '{}' in app.rendering.backends. Skipping it.", name);
                    yield null;
                }
            };
            if (backend != null) {
                backends.add(backend);
            }
        }
        log.info("Initializing render chain with configured backends: {}", config.getBackends());
        return new FallbackRenderChain(backends);
    }

    private static CliRenderBackend cli(CliTool tool, ProcessExecutor processExecutor, RenderingConfig config) {
        return new CliRenderBackend(tool, processExecutor, config.getCliTimeoutSeconds(),
                config.getProbeTimeoutSeconds(), Paths.get(config.getTempDir()));
    }
}
