package com.eyelevel.pagepipeline.service.render;

import com.eyelevel.pagepipeline.service.render.RenderResult.RenderFailure;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Tries each installed backend in priority order and returns the first successful render.
 * Availability is probed once here; backends that fail the probe are never asked to render.
 * The chain itself never throws on a backend failure: a runtime exception from a backend counts
 * as a render error, and when every backend fails the caller receives a {@link RenderFailure}
 * describing all attempts.
 */
@Slf4j
public class FallbackRenderChain {

    private final List<RenderBackend> backends;

    public FallbackRenderChain(List<? extends RenderBackend> configured) {
        List<RenderBackend> available = new ArrayList<>();
        for (RenderBackend backend : configured) {
            if (backend.probe()) {
                available.add(backend);
                log.info("Render backend '{}' is available.", backend.name());
            } else {
                log.warn("Render backend '{}' is not available on this host and will be skipped.", backend.name());
            }
        }
        if (available.isEmpty()) {
            log.warn("No render backend is available. Every page will be replaced by a placeholder.");
        }
        this.backends = List.copyOf(available);
    }

    public List<String> availableBackends() {
        return backends.stream().map(RenderBackend::name).toList();
    }

    public RenderResult render(Path pdf, int pageNumber, int dpi) {
        if (backends.isEmpty()) {
            return RenderResult.unavailable("chain", "no render backend is available");
        }
        List<String> reasons = new ArrayList<>();
        for (RenderBackend backend : backends) {
            RenderResult result = renderGuarded(backend, pdf, pageNumber, dpi);
            if (result instanceof RenderFailure failure) {
                log.warn("Backend '{}' failed on page {} of '{}' ({}): {}", failure.backend(), pageNumber,
                        pdf.getFileName(), failure.kind(), failure.reason());
                reasons.add(failure.backend() + ": " + failure.reason());
                continue;
            }
            log.debug("Page {} of '{}' rendered by '{}'.", pageNumber, pdf.getFileName(), result.backend());
            return result;
        }
        return RenderResult.error("chain", String.join("; ", reasons));
    }

    /**
     * Lets every backend drop whatever it keeps open for {@code pdf}. Called once the caller has
     * rendered all the pages it needs from the document.
     */
    public void release(Path pdf) {
        for (RenderBackend backend : backends) {
            try {
                backend.release(pdf);
            } catch (RuntimeException e) {
                log.warn("Backend '{}' failed to release '{}'.", backend.name(), pdf.getFileName(), e);
            }
        }
    }

    private static RenderResult renderGuarded(RenderBackend backend, Path pdf, int pageNumber, int dpi) {
        try {
            return backend.render(pdf, pageNumber, dpi);
        } catch (RuntimeException e) {
            log.debug("Backend '{}' threw while rendering page {}.", backend.name(), pageNumber, e);
            return RenderResult.error(backend.name(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
