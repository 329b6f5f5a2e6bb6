package ai.pipestream.funnel.cli;

import ai.pipestream.funnel.job.AccessPolicy;
import ai.pipestream.funnel.s3.StoreCredentials;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns {@code BUCKET OPERATION [OPTIONS] [FILE...]} plus the environment into a {@link RunConfiguration}.
 */
public class CommandLineParser {

    public static final String ENV_ACCESS_KEY = "AWS_ACCESS_KEY_ID";
    public static final String ENV_SECRET_KEY = "AWS_SECRET_ACCESS_KEY";

    static final String SYNTAX = "s3-funnel BUCKET OPERATION [OPTIONS] [FILE...]";
    static final String HEADER = "\nOPERATION is one of get, put, list, delete.\n\n";
    static final String FOOTER = "\nCredentials default to " + ENV_ACCESS_KEY + " and " + ENV_SECRET_KEY + ".";

    private final int defaultThreads;
    private final Options options;

    public CommandLineParser(int defaultThreads) {
        this.defaultThreads = defaultThreads;
        this.options = buildOptions();
    }

    private static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("a").longOpt("aws_key").hasArg().argName("KEY")
                .desc("AWS access key id (overrides " + ENV_ACCESS_KEY + ")").build());
        options.addOption(Option.builder("s").longOpt("aws_secret_key").hasArg().argName("SECRET")
                .desc("AWS secret access key (overrides " + ENV_SECRET_KEY + ")").build());
        options.addOption(Option.builder("t").longOpt("threads").hasArg().argName("N")
                .desc("number of worker threads, at least 1").build());
        options.addOption(Option.builder().longOpt("start_key").hasArg().argName("KEY")
                .desc("list: start listing after this key").build());
        options.addOption(Option.builder().longOpt("acl").hasArg().argName("ACL")
                .desc("put: public-read or private (default private)").build());
        options.addOption(Option.builder("i").longOpt("input").hasArg().argName("FILE")
                .desc("read keys or paths from FILE, one per line ('-' for stdin)").build());
        options.addOption(Option.builder("v").longOpt("verbose").desc("debug logging").build());
        options.addOption(Option.builder("h").longOpt("help").desc("print this message").build());
        return options;
    }

    /**
     * @throws ConfigurationException for anything that must stop the run before it starts
     */
    public RunConfiguration parse(String[] args, Map<String, String> env) {
        CommandLine line;
        try {
            line = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
        if (line.hasOption("help")) {
            throw ConfigurationException.help();
        }

        List<String> positional = line.getArgList();
        if (positional.size() < 2) {
            throw new ConfigurationException("BUCKET and OPERATION are required");
        }
        String bucket = positional.get(0).trim();
        if (bucket.isEmpty()) {
            throw new ConfigurationException("BUCKET must not be empty");
        }
        Operation operation = Operation.fromName(positional.get(1));

        return new RunConfiguration(
                bucket,
                operation,
                resolveCredentials(line, env),
                parseThreads(line),
                Optional.ofNullable(line.getOptionValue("start_key")),
                AccessPolicy.fromFlag(line.getOptionValue("acl")),
                Optional.ofNullable(line.getOptionValue("input")),
                line.hasOption("verbose"),
                positional.subList(2, positional.size()));
    }

    private int parseThreads(CommandLine line) {
        String value = line.getOptionValue("threads");
        if (value == null) {
            return defaultThreads;
        }
        int threads;
        try {
            threads = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid thread count '" + value + "'", e);
        }
        if (threads < 1) {
            throw new ConfigurationException("Thread count must be at least 1, was " + threads);
        }
        return threads;
    }

    private static StoreCredentials resolveCredentials(CommandLine line, Map<String, String> env) {
        String accessKey = firstNonBlank(line.getOptionValue("aws_key"), env.get(ENV_ACCESS_KEY));
        String secretKey = firstNonBlank(line.getOptionValue("aws_secret_key"), env.get(ENV_SECRET_KEY));
        if (accessKey == null || secretKey == null) {
            throw new ConfigurationException("Missing AWS credentials: pass -a/-s or set "
                    + ENV_ACCESS_KEY + " and " + ENV_SECRET_KEY);
        }
        return new StoreCredentials(accessKey, secretKey);
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred;
        }
        return fallback != null && !fallback.isBlank() ? fallback : null;
    }

    public void printUsage(PrintWriter out) {
        new HelpFormatter().printHelp(out, HelpFormatter.DEFAULT_WIDTH, SYNTAX, HEADER, options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, FOOTER);
        out.flush();
    }
}
