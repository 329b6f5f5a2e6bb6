package ai.pipestream.funnel.s3;

import ai.pipestream.funnel.worker.Toolbox;
import ai.pipestream.funnel.worker.ToolboxFactory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;

/**
 * Builds S3 clients from {@link S3Config} and per-run credentials.
 * <p>
 * Clients are not shared: every worker gets its own through {@link #toolboxFactory}.
 */
@ApplicationScoped
public class S3Clients {

    private static final Logger LOG = Logger.getLogger(S3Clients.class);

    private final S3Config config;

    @Inject
    public S3Clients(S3Config config) {
        this.config = config;
    }

    /**
     * Creates a new synchronous S3 client. The caller owns it and must close it.
     */
    public S3Client create(StoreCredentials credentials) {
        AwsBasicCredentials basic = AwsBasicCredentials.create(credentials.accessKey(), credentials.secretKey());

        S3ClientBuilder builder = S3Client.builder()
                .credentialsProvider(StaticCredentialsProvider.create(basic))
                .region(Region.of(config.region()))
                .httpClientBuilder(ApacheHttpClient.builder())
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(config.pathStyleAccess())
                        .build());
        config.endpoint().ifPresent(endpoint -> builder.endpointOverride(URI.create(endpoint)));

        LOG.debugf("Creating S3 client: region=%s, endpoint=%s, pathStyle=%s",
                config.region(), config.endpoint().orElse("<aws>"), config.pathStyleAccess());
        return builder.build();
    }

    /**
     * Factory handing each worker a toolbox with its own client bound to {@code bucket}.
     */
    public ToolboxFactory toolboxFactory(StoreCredentials credentials, String bucket) {
        return () -> new Toolbox(new S3ObjectStore(create(credentials)), bucket);
    }
}
