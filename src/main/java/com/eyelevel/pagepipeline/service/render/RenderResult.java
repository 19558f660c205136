package com.eyelevel.pagepipeline.service.render;

import java.awt.image.BufferedImage;

/**
 * The outcome of asking a backend (or the whole chain) for one page. A backend never throws;
 * an uninstalled tool, an unsupported document and a crash during rendering all come back as
 * a {@link RenderFailure}.
 */
public sealed interface RenderResult permits RenderResult.Rendered, RenderResult.RenderFailure {

    static RenderResult rendered(String backend, BufferedImage image) {
        return new Rendered(backend, image);
    }

    static RenderResult unavailable(String backend, String reason) {
        return new RenderFailure(FailureKind.UNAVAILABLE, backend, reason);
    }

    static RenderResult error(String backend, String reason) {
        return new RenderFailure(FailureKind.RENDER_ERROR, backend, reason);
    }

    String backend();

    default boolean isRendered() {
        return this instanceof Rendered;
    }

    enum FailureKind {
        UNAVAILABLE,
        RENDER_ERROR
    }

    record Rendered(String backend, BufferedImage image) implements RenderResult {
    }

    record RenderFailure(FailureKind kind, String backend, String reason) implements RenderResult {
    }
}
