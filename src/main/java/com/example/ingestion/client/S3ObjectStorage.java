package com.example.ingestion.client;

import com.example.ingestion.config.StorageProperties;
import com.example.ingestion.exception.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.time.Duration;

/**
 * S3 backed {@link ObjectStorage}; also works against MinIO through a custom endpoint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class S3ObjectStorage implements ObjectStorage {

    private final S3Client s3Client;
    private final S3Presigner s3Presigner;
    private final StorageProperties properties;

    @Override
    public byte[] download(String key) {
        log.debug("Downloading s3://{}/{}", properties.getBucket(), key);
        try {
            var request = GetObjectRequest.builder()
                    .bucket(properties.getBucket())
                    .key(key)
                    .build();
            var bytes = s3Client.getObjectAsBytes(request).asByteArray();
            log.debug("Downloaded {} bytes from s3://{}/{}", bytes.length, properties.getBucket(), key);
            return bytes;
        } catch (NoSuchKeyException e) {
            throw new StorageException(key, "object does not exist", e);
        } catch (SdkException e) {
            throw new StorageException(key, e.getMessage(), e);
        }
    }

    @Override
    public String publicUrl(String key) {
        try {
            var presignRequest = GetObjectPresignRequest.builder()
                    .signatureDuration(Duration.ofSeconds(properties.getUrlExpirySeconds()))
                    .getObjectRequest(request -> request.bucket(properties.getBucket()).key(key))
                    .build();
            return s3Presigner.presignGetObject(presignRequest).url().toString();
        } catch (SdkException e) {
            throw new StorageException(key, e.getMessage(), e);
        }
    }
}
