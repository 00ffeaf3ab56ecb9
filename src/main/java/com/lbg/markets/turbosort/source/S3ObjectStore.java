package com.lbg.markets.turbosort.source;

import com.lbg.markets.turbosort.config.TurbosortConfig;
import org.jboss.logging.Logger;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Object store backed by S3 or an S3-compatible endpoint.
 * SDK failures surface as {@link IOException}.
 */
public class S3ObjectStore implements ObjectStore, Closeable {

    private static final Logger LOG = Logger.getLogger(S3ObjectStore.class);

    private final S3Client s3client;
    private final String bucket;

    public S3ObjectStore(S3Client s3client, String bucket) {
        this.s3client = s3client;
        this.bucket = bucket;
    }

    public static S3ObjectStore create(TurbosortConfig.S3 config) {
        String bucket = config.bucket()
                .filter(b -> !b.isBlank())
                .orElseThrow(() -> new IllegalStateException("turbosort.source.s3.bucket is required for an s3 source"));

        S3ClientBuilder builder = S3Client.builder()
                .httpClientBuilder(UrlConnectionHttpClient.builder())
                .region(Region.of(config.region()))
                .forcePathStyle(config.pathStyle());
        config.endpoint()
                .filter(e -> !e.isBlank())
                .ifPresent(endpoint -> builder.endpointOverride(URI.create(endpoint)));

        if (config.accessKey().isPresent() && config.secretKey().isPresent()) {
            builder.credentialsProvider(StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(config.accessKey().get(), config.secretKey().get())));
        } else {
            builder.credentialsProvider(DefaultCredentialsProvider.create());
        }

        LOG.infof("Using S3 source bucket %s (endpoint: %s)", bucket, config.endpoint().orElse("default"));
        return new S3ObjectStore(builder.build(), bucket);
    }

    @Override
    public List<ObjectSummary> list(String prefix) throws IOException {
        return list(prefix, null);
    }

    @Override
    public List<ObjectSummary> listChildren(String prefix) throws IOException {
        // Deeper keys roll up into common prefixes, which are not objects
        return list(prefix, "/");
    }

    private List<ObjectSummary> list(String prefix, String delimiter) throws IOException {
        ListObjectsV2Request request = ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(prefix == null || prefix.isEmpty() ? null : prefix)
                .delimiter(delimiter)
                .build();

        List<ObjectSummary> objects = new ArrayList<>();
        try {
            for (S3Object object : s3client.listObjectsV2Paginator(request).contents()) {
                objects.add(new ObjectSummary(
                        object.key(),
                        object.size() != null ? object.size() : 0L,
                        object.lastModified() != null ? object.lastModified().toEpochMilli() : 0L,
                        object.eTag()
                ));
            }
        } catch (SdkException e) {
            throw new IOException("Failed to list s3://" + bucket + "/" + (prefix == null ? "" : prefix), e);
        }
        return objects;
    }

    @Override
    public Optional<ObjectSummary> head(String key) throws IOException {
        try {
            HeadObjectResponse response = s3client.headObject(HeadObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            return Optional.of(new ObjectSummary(
                    key,
                    response.contentLength() != null ? response.contentLength() : 0L,
                    response.lastModified() != null ? response.lastModified().toEpochMilli() : 0L,
                    response.eTag()
            ));
        } catch (NoSuchKeyException e) {
            return Optional.empty();
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return Optional.empty();
            }
            throw new IOException("Failed to head s3://" + bucket + "/" + key, e);
        } catch (SdkException e) {
            throw new IOException("Failed to head s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public InputStream open(String key) throws IOException {
        try {
            return s3client.getObject(GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
        } catch (NoSuchKeyException e) {
            throw new NoSuchFileException(key);
        } catch (SdkException e) {
            throw new IOException("Failed to fetch s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public void close() {
        s3client.close();
    }
}
