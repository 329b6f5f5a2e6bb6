package ai.pipestream.funnel.job;

import ai.pipestream.funnel.cli.Operation;
import ai.pipestream.funnel.store.ObjectStoreException;
import ai.pipestream.funnel.store.RejectedRequestException;
import ai.pipestream.funnel.store.TransientStoreException;
import ai.pipestream.funnel.worker.Toolbox;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Downloads one key to a local file.
 */
public class GetJob extends TransferJob {

    private static final Logger LOG = Logger.getLogger(GetJob.class);

    private final Path localPath;
    private final boolean escapesOutputDir;

    public GetJob(String key, Path localPath, JobOptions options) {
        this(key, localPath, false, options);
    }

    private GetJob(String key, Path localPath, boolean escapesOutputDir, JobOptions options) {
        super(key, options);
        this.localPath = Objects.requireNonNull(localPath, "localPath must not be null");
        this.escapesOutputDir = escapesOutputDir;
    }

    /**
     * Job for {@code key} written under {@code outputDir} at the same relative path.
     * A key whose {@code ..} segments lead outside {@code outputDir} yields a job that fails without
     * touching the filesystem.
     */
    public static GetJob into(Path outputDir, String key, JobOptions options) {
        String relative = key;
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        Path root = outputDir.toAbsolutePath().normalize();
        Path target = root.resolve(relative).normalize();
        return new GetJob(key, target, !target.startsWith(root), options);
    }

    public Path localPath() {
        return localPath;
    }

    @Override
    public Operation operation() {
        return Operation.GET;
    }

    @Override
    protected void perform(Toolbox toolbox) throws ObjectStoreException {
        if (escapesOutputDir) {
            throw new RejectedRequestException("get", toolbox.bucket(), key(), 0,
                    "key resolves outside the output directory: " + localPath);
        }
        Path parent = localPath.toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new TransientStoreException("get", toolbox.bucket(), key(), e);
            }
        }
        toolbox.store().get(toolbox.bucket(), key(), localPath);
    }

    @Override
    public void discardPartialResult() {
        if (escapesOutputDir) {
            return;
        }
        try {
            if (Files.deleteIfExists(localPath)) {
                LOG.debugf("Removed partial download %s", localPath);
            }
        } catch (IOException e) {
            LOG.warnf("Could not remove partial download %s: %s", localPath, e.getMessage());
        }
    }
}
