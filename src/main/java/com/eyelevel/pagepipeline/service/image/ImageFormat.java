package com.eyelevel.pagepipeline.service.image;

/**
 * Output encodings for page images and thumbnails.
 */
public enum ImageFormat {
    JPEG("jpg", false),
    PNG("png", true);

    private final String extension;
    private final boolean supportsAlpha;

    ImageFormat(String extension, boolean supportsAlpha) {
        this.extension = extension;
        this.supportsAlpha = supportsAlpha;
    }

    /**
     * File extension without the dot. Also the ImageIO format name.
     */
    public String extension() {
        return extension;
    }

    public boolean supportsAlpha() {
        return supportsAlpha;
    }
}
