package ai.pipestream.funnel.job;

import ai.pipestream.funnel.cli.Operation;
import ai.pipestream.funnel.store.ObjectStoreException;
import ai.pipestream.funnel.store.RejectedRequestException;
import ai.pipestream.funnel.worker.Toolbox;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Uploads one local file under a key with the run's access policy.
 */
public class PutJob extends TransferJob {

    private final Path localPath;

    public PutJob(String key, Path localPath, JobOptions options) {
        super(key, options);
        this.localPath = Objects.requireNonNull(localPath, "localPath must not be null");
    }

    /**
     * Job for a local path given on the command line or in a manifest. The key is the path as given,
     * with separators normalized to {@code /} and leading {@code ./} or {@code /} removed.
     */
    public static PutJob fromPath(String path, JobOptions options) {
        return new PutJob(keyFor(path), Path.of(path), options);
    }

    static String keyFor(String path) {
        String key = path.replace('\\', '/');
        while (key.startsWith("./") || key.startsWith("/")) {
            key = key.startsWith("./") ? key.substring(2) : key.substring(1);
        }
        return key;
    }

    public Path localPath() {
        return localPath;
    }

    public AccessPolicy accessPolicy() {
        return options().accessPolicy();
    }

    @Override
    public Operation operation() {
        return Operation.PUT;
    }

    @Override
    protected void perform(Toolbox toolbox) throws ObjectStoreException {
        // A missing source file will not appear by retrying
        if (!Files.isRegularFile(localPath) || !Files.isReadable(localPath)) {
            throw new RejectedRequestException("put", toolbox.bucket(), key(), 0,
                    "local file is missing or unreadable: " + localPath);
        }
        toolbox.store().put(toolbox.bucket(), key(), localPath, accessPolicy().cannedAcl());
    }
}
