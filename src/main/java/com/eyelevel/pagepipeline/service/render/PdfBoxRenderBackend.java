package com.eyelevel.pagepipeline.service.render;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * In-process renderer backed by Apache PDFBox. It needs nothing installed on the host, so it is
 * normally configured last as the backend of last resort before the placeholder.
 * <p>
 * The parsed document is kept open per worker thread, so the pages of one document are rendered
 * from a single parse. {@link #release(Path)} closes it; opening a different file also closes
 * the previous one.
 */
@Slf4j
public class PdfBoxRenderBackend implements RenderBackend {

    private final ThreadLocal<OpenDocument> openDocument = new ThreadLocal<>();

    @Override
    public String name() {
        return "pdfbox";
    }

    @Override
    public boolean probe() {
        return true;
    }

    @Override
    public RenderResult render(Path pdf, int pageNumber, int dpi) {
        try {
            OpenDocument open = open(pdf);
            int pages = open.document().getNumberOfPages();
            if (pageNumber < 1 || pageNumber > pages) {
                return RenderResult.error(name(),
                        String.format("page %d out of range, document has %d pages", pageNumber, pages));
            }
            BufferedImage image = open.renderer().renderImageWithDPI(pageNumber - 1, dpi, ImageType.RGB);
            return RenderResult.rendered(name(), image);
        } catch (InvalidPasswordException e) {
            return RenderResult.error(name(), "document is password protected");
        } catch (IOException | RuntimeException e) {
            log.debug("PDFBox failed on page {} of '{}'.", pageNumber, pdf.getFileName(), e);
            return RenderResult.error(name(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    @Override
    public void release(Path pdf) {
        OpenDocument open = openDocument.get();
        if (open != null && open.path().equals(normalize(pdf))) {
            close();
        }
    }

    boolean holdsOpen(Path pdf) {
        OpenDocument open = openDocument.get();
        return open != null && open.path().equals(normalize(pdf));
    }

    private OpenDocument open(Path pdf) throws IOException {
        Path path = normalize(pdf);
        OpenDocument current = openDocument.get();
        if (current != null && current.path().equals(path)) {
            return current;
        }
        close();
        PDDocument document = Loader.loadPDF(path.toFile());
        OpenDocument opened = new OpenDocument(path, document, new PDFRenderer(document));
        openDocument.set(opened);
        log.debug("PDFBox opened '{}' with {} pages.", path.getFileName(), document.getNumberOfPages());
        return opened;
    }

    private void close() {
        OpenDocument open = openDocument.get();
        openDocument.remove();
        if (open == null) {
            return;
        }
        try {
            open.document().close();
        } catch (IOException e) {
            log.warn("Error closing PDF '{}'.", open.path().getFileName(), e);
        }
    }

    private static Path normalize(Path pdf) {
        return pdf.toAbsolutePath().normalize();
    }

    private record OpenDocument(Path path, PDDocument document, PDFRenderer renderer) {
    }
}
