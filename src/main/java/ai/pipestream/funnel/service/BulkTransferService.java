package ai.pipestream.funnel.service;

import ai.pipestream.funnel.cli.RunConfiguration;
import ai.pipestream.funnel.config.FunnelConfiguration;
import ai.pipestream.funnel.dispatch.InterruptHandler;
import ai.pipestream.funnel.dispatch.StopSignal;
import ai.pipestream.funnel.input.InputEnumerator;
import ai.pipestream.funnel.job.ExponentialBackoff;
import ai.pipestream.funnel.job.RetryingJobExecutor;
import ai.pipestream.funnel.job.Sleeper;
import ai.pipestream.funnel.metrics.TransferMetrics;
import ai.pipestream.funnel.s3.S3Clients;
import ai.pipestream.funnel.store.StoreListingException;
import ai.pipestream.funnel.worker.StartupException;
import ai.pipestream.funnel.worker.Toolbox;
import ai.pipestream.funnel.worker.ToolboxFactory;
import com.google.common.base.Stopwatch;
import io.quarkus.runtime.ShutdownEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs one invocation against S3 and maps its result to a process exit code.
 */
@ApplicationScoped
public class BulkTransferService {

    private static final Logger LOG = Logger.getLogger(BulkTransferService.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    private final FunnelConfiguration config;
    private final S3Clients s3Clients;
    private final TransferMetrics metrics;
    private final AtomicReference<InterruptHandler> activeRun = new AtomicReference<>();

    @Inject
    public BulkTransferService(FunnelConfiguration config, S3Clients s3Clients, TransferMetrics metrics) {
        this.config = config;
        this.s3Clients = s3Clients;
        this.metrics = metrics;
    }

    public int execute(RunConfiguration run, Supplier<InputStream> stdin, PrintStream out) {
        ToolboxFactory toolboxFactory = s3Clients.toolboxFactory(run.credentials(), run.bucket());
        return switch (run.operation()) {
            case LIST -> list(run, toolboxFactory, out);
            case GET, PUT, DELETE -> transfer(run, toolboxFactory, new InputEnumerator(stdin));
        };
    }

    int transfer(RunConfiguration run, ToolboxFactory toolboxFactory, InputEnumerator inputs) {
        InterruptHandler interrupts = new InterruptHandler(new StopSignal(), config.shutdown().gracePeriod());
        activeRun.set(interrupts);

        BulkTransfer transfer = new BulkTransfer(
                toolboxFactory,
                new RetryingJobExecutor(
                        new ExponentialBackoff(config.job().backoffBase(), config.job().backoffMax()),
                        Sleeper.THREAD),
                metrics,
                config.job().retries(),
                Path.of(config.get().outputDir()));

        Stopwatch stopwatch = Stopwatch.createStarted();
        LOG.infof("Starting %s on bucket %s with %d worker(s)", run.operation().label(), run.bucket(), run.threads());
        try {
            long submitted = transfer.run(run, inputs, interrupts.signal());
            LOG.infof("Finished %s of %d item(s) in %s: %s",
                    run.operation().label(), submitted, stopwatch, metrics.summary());
            return EXIT_OK;
        } catch (StartupException e) {
            LOG.errorf(e, "Could not start workers: %s", e.getMessage());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            LOG.errorf(e, "%s on bucket %s aborted: %s", run.operation().label(), run.bucket(), e.getMessage());
            return EXIT_FAILURE;
        } finally {
            interrupts.finished();
            activeRun.compareAndSet(interrupts, null);
        }
    }

    int list(RunConfiguration run, ToolboxFactory toolboxFactory, PrintStream out) {
        try (Toolbox toolbox = toolboxFactory.create()) {
            long count = new ListOperation(toolbox).list(run.startKey(), out);
            LOG.debugf("Listed %d key(s) from %s", count, run.bucket());
            return EXIT_OK;
        } catch (StoreListingException e) {
            LOG.errorf("Listing %s failed: %s", run.bucket(), e.getCause().getMessage());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Listing %s failed: %s", run.bucket(), e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * Quarkus fires this on SIGINT/SIGTERM before tearing the application down.
     */
    void onShutdown(@Observes ShutdownEvent event) {
        InterruptHandler interrupts = activeRun.get();
        if (interrupts != null) {
            interrupts.onInterrupt();
        }
    }
}
