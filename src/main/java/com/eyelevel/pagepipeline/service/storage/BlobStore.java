package com.eyelevel.pagepipeline.service.storage;

import java.util.List;

/**
 * Storage contract for rendered images. Keys are slash-separated relative paths such as
 * {@code pages/page_12_3.jpg}; the returned reference is what gets persisted on the document
 * or page row.
 */
public interface BlobStore {

    /**
     * Stores {@code content} under {@code key}, replacing any existing object.
     *
     * @return the public reference (URL) of the stored object
     * @throws com.eyelevel.pagepipeline.exception.BlobStorageException on any storage failure
     */
    String store(String key, byte[] content);

    /**
     * Copies an existing object to a new key without passing its bytes through the caller.
     *
     * @return the public reference (URL) of the copy
     * @throws com.eyelevel.pagepipeline.exception.BlobStorageException if the source is missing or the copy fails
     */
    String copy(String sourceKey, String destinationKey);

    /**
     * Lists every object whose key starts with {@code prefix}, a directory-style prefix such as
     * {@code pages/}.
     *
     * @throws com.eyelevel.pagepipeline.exception.BlobStorageException if the listing fails
     */
    List<StoredBlob> list(String prefix);

    /**
     * Removes the object under {@code key}. Deleting a missing object is not an error.
     *
     * @throws com.eyelevel.pagepipeline.exception.BlobStorageException if the delete fails
     */
    void delete(String key);

    /**
     * @return the reference {@link #store} would return for {@code key}
     */
    String referenceOf(String key);
}
