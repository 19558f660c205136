package com.eyelevel.pagepipeline.service.image;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Synthesizes a stand-in page when no backend could render the real one, so a document always
 * ends up with one image per page.
 */
@Slf4j
@Component
public class PlaceholderPageGenerator {

    static final Color PAPER = new Color(0xFD, 0xF5, 0xE6);
    static final Color TEXT = new Color(0x66, 0x66, 0x66);

    private static final int A4_WIDTH_POINTS = 595;
    private static final int A4_HEIGHT_POINTS = 842;

    public BufferedImage placeholder(int pageNumber, int width, int height) {
        int w = Math.max(1, width);
        int h = Math.max(1, height);
        BufferedImage image = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(PAPER);
            g.fillRect(0, 0, w, h);

            drawLabel(g, "Page " + pageNumber, w, h);
        } finally {
            g.dispose();
        }
        return image;
    }

    /**
     * Hosts without usable fonts get a blank page rather than an error.
     */
    private static void drawLabel(Graphics2D g, String label, int w, int h) {
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(TEXT);
            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, Math.max(1, w / 20)));
            FontMetrics metrics = g.getFontMetrics();
            int x = (w - metrics.stringWidth(label)) / 2;
            int y = (h - metrics.getHeight()) / 2 + metrics.getAscent();
            g.drawString(label, x, y);
        } catch (RuntimeException | InternalError e) {
            log.warn("Could not draw placeholder label '{}': {}", label, e.toString());
        }
    }

    public int defaultWidth(int dpi) {
        return Math.max(1, A4_WIDTH_POINTS * dpi / 72);
    }

    public int defaultHeight(int dpi) {
        return Math.max(1, A4_HEIGHT_POINTS * dpi / 72);
    }
}
