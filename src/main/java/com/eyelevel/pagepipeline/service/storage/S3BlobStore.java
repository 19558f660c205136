package com.eyelevel.pagepipeline.service.storage;

import com.eyelevel.pagepipeline.exception.BlobStorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetUrlRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.util.List;

/**
 * Stores blobs in a single S3 bucket. Active when {@code app.storage.type=s3}.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.storage", name = "type", havingValue = "s3")
public class S3BlobStore implements BlobStore {

    private final S3Client s3Client;
    private final String bucketName;

    public S3BlobStore(final S3Client s3Client, @Value("${aws.s3.bucket}") final String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        log.info("S3BlobStore initialized for bucket '{}'.", bucketName);
    }

    @Override
    public String store(final String key, final byte[] content) {
        final PutObjectRequest request = PutObjectRequest.builder().bucket(bucketName).key(key)
                .contentType(contentTypeOf(key)).build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(content));
        } catch (SdkException e) {
            throw new BlobStorageException("Failed to upload object to S3 key '" + key + "'", e);
        }
        log.debug("Uploaded {} bytes to S3 key: {}", content.length, key);
        return urlOf(key);
    }

    @Override
    public String copy(final String sourceKey, final String destinationKey) {
        log.info("Copying S3 object from '{}' to '{}'", sourceKey, destinationKey);
        final CopyObjectRequest copyReq = CopyObjectRequest.builder().sourceBucket(bucketName).sourceKey(sourceKey)
                .destinationBucket(bucketName).destinationKey(destinationKey).build();
        try {
            s3Client.copyObject(copyReq);
        } catch (SdkException e) {
            throw new BlobStorageException(
                    "Failed to copy S3 object from '" + sourceKey + "' to '" + destinationKey + "'", e);
        }
        return urlOf(destinationKey);
    }

    @Override
    public List<StoredBlob> list(final String prefix) {
        final ListObjectsV2Request request = ListObjectsV2Request.builder().bucket(bucketName).prefix(prefix).build();
        try {
            return s3Client.listObjectsV2Paginator(request).contents().stream()
                    .map(object -> new StoredBlob(object.key(), object.size(), object.lastModified()))
                    .toList();
        } catch (SdkException e) {
            throw new BlobStorageException("Failed to list S3 objects under '" + prefix + "'", e);
        }
    }

    @Override
    public void delete(final String key) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucketName).key(key).build());
        } catch (SdkException e) {
            throw new BlobStorageException("Failed to delete S3 object '" + key + "'", e);
        }
        log.debug("Deleted S3 object: {}", key);
    }

    @Override
    public String referenceOf(final String key) {
        return urlOf(key);
    }

    private String urlOf(final String key) {
        return s3Client.utilities().getUrl(GetUrlRequest.builder().bucket(bucketName).key(key).build()).toString();
    }

    private static String contentTypeOf(final String key) {
        return key.endsWith(".png") ? "image/png" : "image/jpeg";
    }
}
