package ai.pipestream.funnel.service;

import ai.pipestream.funnel.cli.Operation;
import ai.pipestream.funnel.cli.RunConfiguration;
import ai.pipestream.funnel.config.FunnelConfiguration;
import ai.pipestream.funnel.input.InputEnumerator;
import ai.pipestream.funnel.job.AccessPolicy;
import ai.pipestream.funnel.s3.S3Config;
import ai.pipestream.funnel.s3.StoreCredentials;
import ai.pipestream.funnel.store.InMemoryObjectStore;
import ai.pipestream.funnel.store.StoreListingException;
import ai.pipestream.funnel.store.TransientStoreException;
import ai.pipestream.funnel.worker.Toolbox;
import ai.pipestream.funnel.worker.ToolboxFactory;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wiring, configuration defaults and exit codes of the injected service.
 */
@QuarkusTest
class BulkTransferServiceTest {

    @Inject
    BulkTransferService service;

    @Inject
    FunnelConfiguration config;

    @Inject
    S3Config s3Config;

    private static RunConfiguration run(Operation operation, int threads, List<String> items) {
        return new RunConfiguration("test-bucket", operation, new StoreCredentials("k", "s"), threads,
                Optional.empty(), AccessPolicy.PRIVATE, Optional.empty(), false, items);
    }

    private static InputEnumerator noStdin() {
        return new InputEnumerator(() -> new ByteArrayInputStream(new byte[0]));
    }

    @Test
    void configurationDefaults() {
        assertEquals(1, config.pool().threads());
        assertEquals(5, config.job().retries());
        assertEquals(Duration.ofMillis(1), config.job().backoffBase());
        assertEquals(Duration.ofMinutes(5), config.shutdown().gracePeriod());
        assertEquals("us-east-1", s3Config.region());
        assertTrue(s3Config.endpoint().isEmpty());
    }

    @Test
    void deleteRunSucceeds() {
        InMemoryObjectStore store = new InMemoryObjectStore().putObject("a", "1").putObject("b", "2");
        ToolboxFactory toolboxes = () -> new Toolbox(store, "test-bucket");

        int exit = service.transfer(run(Operation.DELETE, 2, List.of("a", "b")), toolboxes, noStdin());

        assertEquals(BulkTransferService.EXIT_OK, exit);
        assertTrue(store.keys().isEmpty());
    }

    @Test
    void workerStartupFailureExitsWithFailure() {
        ToolboxFactory broken = () -> {
            throw new IllegalStateException("no client");
        };

        assertEquals(BulkTransferService.EXIT_FAILURE,
                service.transfer(run(Operation.DELETE, 1, List.of("a")), broken, noStdin()));
    }

    @Test
    void listPrintsKeys() {
        InMemoryObjectStore store = new InMemoryObjectStore().putObject("x", "").putObject("y", "");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        int exit = service.list(run(Operation.LIST, 1, List.of()), () -> new Toolbox(store, "test-bucket"),
                new PrintStream(buffer, true, StandardCharsets.UTF_8));

        assertEquals(BulkTransferService.EXIT_OK, exit);
        assertEquals("x" + System.lineSeparator() + "y" + System.lineSeparator(),
                buffer.toString(StandardCharsets.UTF_8));
        assertEquals(1, store.closeCount());
    }

    @Test
    void listFailureExitsWithFailure() {
        InMemoryObjectStore failing = new InMemoryObjectStore() {
            @Override
            public Iterable<String> list(String bucket, Optional<String> startAfter) {
                throw new StoreListingException(new TransientStoreException("list", bucket, "", "timed out"));
            }
        };

        assertEquals(BulkTransferService.EXIT_FAILURE, service.list(run(Operation.LIST, 1, List.of()),
                () -> new Toolbox(failing, "test-bucket"), new PrintStream(new ByteArrayOutputStream())));
    }

    @Test
    void listClientFailureExitsWithFailure() {
        ToolboxFactory broken = () -> {
            throw new IllegalStateException("no client");
        };

        assertEquals(BulkTransferService.EXIT_FAILURE, service.list(run(Operation.LIST, 1, List.of()),
                broken, new PrintStream(new ByteArrayOutputStream())));
    }

    @Test
    void unexpectedInputFailureExitsWithFailure() {
        InMemoryObjectStore store = new InMemoryObjectStore();
        InputEnumerator unreadable = new InputEnumerator(() -> {
            throw new IllegalStateException("stdin closed");
        });

        int exit = service.transfer(run(Operation.DELETE, 1, List.of()),
                () -> new Toolbox(store, "test-bucket"), unreadable);

        assertEquals(BulkTransferService.EXIT_FAILURE, exit);
        assertEquals(1, store.closeCount());
    }
}
