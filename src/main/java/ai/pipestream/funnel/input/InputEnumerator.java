package ai.pipestream.funnel.input;

import ai.pipestream.funnel.cli.Operation;
import org.jboss.logging.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Decides which items a run operates on.
 * <p>
 * The first available source wins: manifest file ({@code -} meaning stdin), positional arguments
 * (glob-expanded for put), stdin. Items come out trimmed and non-empty, lazily, once.
 */
public class InputEnumerator {

    private static final Logger LOG = Logger.getLogger(InputEnumerator.class);

    public static final String STDIN = "-";

    private static final char REPLACEMENT = '\uFFFD';

    private final Supplier<InputStream> stdin;
    private final GlobExpander globExpander;

    public InputEnumerator(Supplier<InputStream> stdin) {
        this(stdin, new GlobExpander());
    }

    public InputEnumerator(Supplier<InputStream> stdin, GlobExpander globExpander) {
        this.stdin = stdin;
        this.globExpander = globExpander;
    }

    /**
     * The returned stream may hold an open file; close it when done.
     */
    public Stream<String> resolve(Optional<String> manifest, List<String> arguments, Operation operation) {
        if (manifest.isPresent()) {
            String source = manifest.get();
            LOG.debugf("Reading %s items from manifest %s", operation.label(), source);
            return STDIN.equals(source) ? fromStdin() : fromManifest(Path.of(source));
        }
        if (!arguments.isEmpty()) {
            Stream<String> items = arguments.stream().map(String::trim).filter(item -> !item.isEmpty());
            return operation.readsLocalFiles() ? items.flatMap(this::expand) : items;
        }
        LOG.debugf("Reading %s items from stdin", operation.label());
        return fromStdin();
    }

    private Stream<String> expand(String pattern) {
        List<String> matches = globExpander.expand(pattern);
        if (matches.isEmpty()) {
            LOG.errorf("No files match '%s', skipping", pattern);
        }
        return matches.stream();
    }

    private Stream<String> fromManifest(Path path) {
        BufferedReader reader;
        try {
            reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), lenientUtf8()));
        } catch (IOException e) {
            LOG.errorf("Cannot read manifest %s: %s", path, e.toString());
            return Stream.empty();
        }
        return clean(reader.lines()).onClose(() -> {
            try {
                reader.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    private Stream<String> fromStdin() {
        // stdin belongs to the process; it is not closed here
        BufferedReader reader = new BufferedReader(new InputStreamReader(stdin.get(), lenientUtf8()));
        return clean(reader.lines());
    }

    /**
     * Malformed bytes decode to U+FFFD instead of failing the whole stream; such lines are dropped in {@link #clean}.
     */
    private static CharsetDecoder lenientUtf8() {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
    }

    private static Stream<String> clean(Stream<String> lines) {
        return lines.map(String::trim)
                .filter(line -> !line.isEmpty())
                .filter(InputEnumerator::isDecodable);
    }

    private static boolean isDecodable(String line) {
        if (line.indexOf(REPLACEMENT) >= 0) {
            LOG.errorf("Skipping input line that is not valid UTF-8: '%s'", line);
            return false;
        }
        return true;
    }
}
