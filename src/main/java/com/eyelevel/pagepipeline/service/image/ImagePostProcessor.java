package com.eyelevel.pagepipeline.service.image;

import com.eyelevel.pagepipeline.exception.ImageEncodingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.MemoryCacheImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Scales rendered pages into thumbnails and encodes rasters into their stored byte form.
 * Stateless and safe to share between worker threads.
 */
@Slf4j
@Component
public class ImagePostProcessor {

    /**
     * Encodes an image. For formats without an alpha channel the image is first flattened onto
     * white, which also normalizes indexed and grayscale rasters to RGB.
     *
     * @param image   the raster to encode
     * @param format  target format
     * @param quality 1..100, only used by lossy formats
     * @return the encoded bytes
     * @throws ImageEncodingException if no writer is available or writing fails
     */
    public byte[] encode(BufferedImage image, ImageFormat format, int quality) {
        BufferedImage source = format.supportsAlpha() ? image : toRgb(image);
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.extension());
        if (!writers.hasNext()) {
            throw new ImageEncodingException("No ImageIO writer available for format " + format);
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (MemoryCacheImageOutputStream ios = new MemoryCacheImageOutputStream(out)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (format == ImageFormat.JPEG && param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(Math.max(1, Math.min(100, quality)) / 100f);
            }
            writer.write(null, new IIOImage(source, null, null), param);
            ios.flush();
        } catch (IOException e) {
            throw new ImageEncodingException("Failed to encode image as " + format, e);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }

    /**
     * Downscales to fit inside {@code maxWidth x maxHeight}, keeping the aspect ratio. Images that
     * already fit are copied at their original size, never enlarged.
     */
    public BufferedImage thumbnail(BufferedImage image, int maxWidth, int maxHeight) {
        int width = image.getWidth();
        int height = image.getHeight();
        double scale = Math.min(1.0, Math.min((double) maxWidth / width, (double) maxHeight / height));
        int targetWidth = Math.max(1, (int) Math.round(width * scale));
        int targetHeight = Math.max(1, (int) Math.round(height * scale));

        BufferedImage scaled = new BufferedImage(targetWidth, targetHeight,
                image.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.drawImage(image, 0, 0, targetWidth, targetHeight, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    private static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }
}
