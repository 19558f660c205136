package com.eyelevel.pagepipeline.service.storage;

import java.time.Instant;

/**
 * One object found by {@link BlobStore#list(String)}.
 */
public record StoredBlob(String key, long size, Instant lastModified) {
}
