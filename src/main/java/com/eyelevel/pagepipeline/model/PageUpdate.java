package com.eyelevel.pagepipeline.model;

/**
 * The fields written for a page on upsert.
 */
public record PageUpdate(String image, String thumbnail, int width, int height) {
}
