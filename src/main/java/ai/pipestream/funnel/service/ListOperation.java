package ai.pipestream.funnel.service;

import ai.pipestream.funnel.worker.Toolbox;
import org.jboss.logging.Logger;

import java.io.PrintStream;
import java.util.Optional;

/**
 * Prints the keys of a bucket, one per line. Runs on the calling thread.
 */
public class ListOperation {

    private static final Logger LOG = Logger.getLogger(ListOperation.class);

    private final Toolbox toolbox;

    public ListOperation(Toolbox toolbox) {
        this.toolbox = toolbox;
    }

    /**
     * @return number of keys printed
     * @throws ai.pipestream.funnel.store.StoreListingException if a listing page fails
     */
    public long list(Optional<String> startKey, PrintStream out) {
        LOG.debugf("Listing s3://%s starting after '%s'", toolbox.bucket(), startKey.orElse(""));
        long count = 0;
        for (String key : toolbox.store().list(toolbox.bucket(), startKey)) {
            out.println(key);
            count++;
        }
        out.flush();
        return count;
    }
}
