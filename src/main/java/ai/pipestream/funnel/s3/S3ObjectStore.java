package ai.pipestream.funnel.s3;

import ai.pipestream.funnel.store.ObjectStore;
import ai.pipestream.funnel.store.ObjectStoreException;
import ai.pipestream.funnel.store.RejectedRequestException;
import ai.pipestream.funnel.store.StoreListingException;
import ai.pipestream.funnel.store.TransientStoreException;
import com.google.common.collect.AbstractIterator;
import org.jboss.logging.Logger;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.Optional;

/**
 * {@link ObjectStore} backed by one AWS SDK v2 {@link S3Client}.
 * <p>
 * Service responses with status 5xx or flagged as throttling are transient, any other service
 * response is a rejection. Client-side SDK and I/O failures are transient.
 */
public class S3ObjectStore implements ObjectStore {

    private static final Logger LOG = Logger.getLogger(S3ObjectStore.class);

    private final S3Client s3;

    public S3ObjectStore(S3Client s3) {
        this.s3 = s3;
    }

    @Override
    public void get(String bucket, String key, Path target) throws ObjectStoreException {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();

        try (ResponseInputStream<GetObjectResponse> in = s3.getObject(request)) {
            long bytes;
            try {
                bytes = Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException | UncheckedIOException e) {
                // a half-read connection must not go back to the pool
                in.abort();
                throw e;
            }
            LOG.debugf("Downloaded s3://%s/%s to %s (bytes=%d)", bucket, key, target, bytes);
        } catch (AwsServiceException e) {
            throw classify("get", bucket, key, e);
        } catch (SdkClientException | IOException | UncheckedIOException e) {
            throw new TransientStoreException("get", bucket, key, e);
        }
    }

    @Override
    public void put(String bucket, String key, Path source, String cannedAcl) throws ObjectStoreException {
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .acl(ObjectCannedACL.fromValue(cannedAcl))
                    .contentLength(Files.size(source))
                    .build();

            String etag = s3.putObject(request, RequestBody.fromFile(source)).eTag();
            LOG.debugf("Uploaded %s to s3://%s/%s (acl=%s, etag=%s)", source, bucket, key, cannedAcl, etag);
        } catch (AwsServiceException e) {
            throw classify("put", bucket, key, e);
        } catch (SdkClientException | IOException | UncheckedIOException e) {
            throw new TransientStoreException("put", bucket, key, e);
        }
    }

    @Override
    public void delete(String bucket, String key) throws ObjectStoreException {
        try {
            s3.deleteObject(DeleteObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            LOG.debugf("Deleted s3://%s/%s", bucket, key);
        } catch (AwsServiceException e) {
            throw classify("delete", bucket, key, e);
        } catch (SdkClientException e) {
            throw new TransientStoreException("delete", bucket, key, e);
        }
    }

    @Override
    public Iterable<String> list(String bucket, Optional<String> startAfter) {
        ListObjectsV2Request.Builder request = ListObjectsV2Request.builder().bucket(bucket);
        startAfter.ifPresent(request::startAfter);
        ListObjectsV2Request built = request.build();

        return () -> new AbstractIterator<>() {
            private Iterator<S3Object> pages;

            @Override
            protected String computeNext() {
                try {
                    if (pages == null) {
                        pages = s3.listObjectsV2Paginator(built).contents().iterator();
                    }
                    return pages.hasNext() ? pages.next().key() : endOfData();
                } catch (AwsServiceException e) {
                    throw new StoreListingException(classify("list", bucket, startAfter.orElse(""), e));
                } catch (SdkClientException e) {
                    throw new StoreListingException(
                            new TransientStoreException("list", bucket, startAfter.orElse(""), e));
                }
            }
        };
    }

    @Override
    public void close() {
        s3.close();
    }

    static ObjectStoreException classify(String operation, String bucket, String key, AwsServiceException e) {
        if (e.statusCode() >= 500 || e.isThrottlingException()) {
            return new TransientStoreException(operation, bucket, key, e);
        }
        return new RejectedRequestException(operation, bucket, key, e.statusCode(), e);
    }
}
