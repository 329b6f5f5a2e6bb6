package ai.pipestream.funnel;

import ai.pipestream.funnel.cli.CommandLineParser;
import ai.pipestream.funnel.cli.ConfigurationException;
import ai.pipestream.funnel.cli.RunConfiguration;
import ai.pipestream.funnel.config.FunnelConfiguration;
import ai.pipestream.funnel.service.BulkTransferService;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;

/**
 * Command-line entry point: {@code s3-funnel BUCKET OPERATION [OPTIONS] [FILE...]}.
 */
@QuarkusMain
@ApplicationScoped
public class FunnelApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(FunnelApplication.class);

    public static final int EXIT_USAGE = 2;

    private static final java.util.logging.Logger ROOT_CATEGORY =
            java.util.logging.Logger.getLogger("ai.pipestream.funnel");

    @Inject
    FunnelConfiguration config;

    @Inject
    BulkTransferService transferService;

    public static void main(String... args) {
        Quarkus.run(FunnelApplication.class, args);
    }

    @Override
    public int run(String... args) {
        CommandLineParser parser = new CommandLineParser(config.pool().threads());
        RunConfiguration run;
        try {
            run = parser.parse(args, System.getenv());
        } catch (ConfigurationException e) {
            if (e.isHelpRequested()) {
                parser.printUsage(new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
                return BulkTransferService.EXIT_OK;
            }
            PrintWriter err = new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8));
            err.println("error: " + e.getMessage());
            parser.printUsage(err);
            return EXIT_USAGE;
        }

        if (run.verbose()) {
            ROOT_CATEGORY.setLevel(Level.FINE);
        }
        LOG.debugf("Parsed invocation: %s", run);
        return transferService.execute(run, () -> System.in, System.out);
    }
}
