package org.cobbzilla.swifts3mirror;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.ClientConfiguration;
import com.amazonaws.SdkClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.PutObjectRequest;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

@Slf4j
public class S3DestinationStore implements DestinationStore {

    public static final Set<String> EXPIRED_CREDENTIALS_CODES = new HashSet<String>(
            Arrays.asList("ExpiredToken", "ExpiredTokenException"));

    private final AmazonS3 client;

    public S3DestinationStore(AmazonS3 client) {
        this.client = client;
    }

    /**
     * Builds a store whose client retries nothing on its own: upload retries belong to {@link KeyUploader}.
     */
    public static DestinationStoreFactory factory(MirrorOptions options) {
        return credentials -> new S3DestinationStore(buildClient(credentials, options));
    }

    static AmazonS3 buildClient(MirrorCredentials credentials, MirrorOptions options) {
        final ClientConfiguration clientConfiguration = new ClientConfiguration()
                .withMaxConnections(options.getMaxWorkers() + 2)
                .withConnectionTimeout(options.getRequestTimeoutMillis())
                .withSocketTimeout(options.getRequestTimeoutMillis())
                .withMaxErrorRetry(0);

        return AmazonS3ClientBuilder
                .standard()
                .withRegion(options.getRegionName())
                .withClientConfiguration(clientConfiguration)
                .withCredentials(credentials.toProvider())
                .build();
    }

    @Override
    public boolean bucketExists(String bucket) {
        try {
            return client.doesBucketExistV2(bucket);
        } catch (SdkClientException e) {
            throw translate("Failed to access bucket " + bucket, e);
        }
    }

    @Override
    public KeyListing listObjects(String bucket, String continuationToken) {
        final ListObjectsV2Request request = new ListObjectsV2Request().withBucketName(bucket);
        if (continuationToken != null) request.setContinuationToken(continuationToken);
        try {
            final ListObjectsV2Result result = client.listObjectsV2(request);
            return new KeyListing(KeyObjectSummary.S3ObjectSummaryToKeyObject(result.getObjectSummaries()),
                    result.isTruncated() ? result.getNextContinuationToken() : null);
        } catch (SdkClientException e) {
            throw translate("Failed to list bucket " + bucket, e);
        }
    }

    @Override
    public String getObjectETag(String bucket, String key) throws ObjectNotFoundException {
        try {
            return client.getObjectMetadata(bucket, key).getETag();
        } catch (AmazonServiceException e) {
            if (e.getStatusCode() == 404) throw new ObjectNotFoundException(bucket, key);
            throw translate("Failed to get metadata for " + key, e);
        } catch (SdkClientException e) {
            throw translate("Failed to get metadata for " + key, e);
        }
    }

    @Override
    public void upload(String bucket, String key, Path file, BandwidthThrottle throttle) {
        try (InputStream in = throttle.throttle(new BufferedInputStream(Files.newInputStream(file)))) {
            final ObjectMetadata metadata = new ObjectMetadata();
            metadata.setContentLength(Files.size(file));
            client.putObject(new PutObjectRequest(bucket, key, in, metadata));

        } catch (IOException e) {
            throw new StoreException("Could not read staged file " + file + " for " + key, e);
        } catch (SdkClientException e) {
            throw translate("Failed to upload " + key, e);
        }
    }

    @Override
    public void createMarker(String bucket, String key) {
        final ObjectMetadata metadata = new ObjectMetadata();
        metadata.setContentLength(0);
        try {
            client.putObject(new PutObjectRequest(bucket, key, new ByteArrayInputStream(new byte[0]), metadata));
        } catch (SdkClientException e) {
            throw translate("Failed to create marker " + key, e);
        }
    }

    static StoreException translate(String message, SdkClientException e) {
        if (e instanceof AmazonServiceException) {
            final AmazonServiceException ase = (AmazonServiceException) e;
            if (EXPIRED_CREDENTIALS_CODES.contains(ase.getErrorCode())) {
                return new CredentialsExpiredException(message + ": credentials expired", e);
            }
            return new StoreException(message + ": " + ase.getErrorCode() + " (" + ase.getStatusCode() + ")", e);
        }
        return new StoreException(message + ": " + e.getMessage(), e);
    }
}
