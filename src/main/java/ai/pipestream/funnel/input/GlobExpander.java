package ai.pipestream.funnel.input;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Expands shell-style glob patterns ({@code *}, {@code ?}, {@code [..]}, {@code {a,b}}, {@code **})
 * against the local filesystem. Only regular files are returned, in sorted order.
 */
public class GlobExpander {

    private static final Logger LOG = Logger.getLogger(GlobExpander.class);

    private final FileSystem fileSystem;

    public GlobExpander() {
        this(FileSystems.getDefault());
    }

    GlobExpander(FileSystem fileSystem) {
        this.fileSystem = fileSystem;
    }

    public List<String> expand(String pattern) {
        if (!isGlob(pattern)) {
            Path literal = fileSystem.getPath(pattern);
            return Files.isRegularFile(literal) ? List.of(pattern) : List.of();
        }

        String separator = fileSystem.getSeparator();
        List<String> segments = splitSegments(pattern, separator);
        List<String> baseSegments = new ArrayList<>();
        for (String segment : segments) {
            if (isGlob(segment)) {
                break;
            }
            baseSegments.add(segment);
        }
        List<String> globSegments = segments.subList(baseSegments.size(), segments.size());
        int maxDepth = globSegments.stream().anyMatch(s -> s.contains("**"))
                ? Integer.MAX_VALUE
                : globSegments.size();

        String baseText = String.join(separator, baseSegments);
        if (pattern.startsWith(separator) && !baseText.startsWith(separator)) {
            baseText = separator + baseText;
        }
        Path base = fileSystem.getPath(baseText);
        if (!Files.isDirectory(base)) {
            return List.of();
        }

        PathMatcher matcher = fileSystem.getPathMatcher("glob:" + pattern);
        try (Stream<Path> walk = Files.walk(base, maxDepth)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(matcher::matches)
                    .map(Path::toString)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            LOG.errorf("Could not expand '%s': %s", pattern, e.getMessage());
            return List.of();
        }
    }

    static boolean isGlob(String text) {
        for (int i = 0; i < text.length(); i++) {
            switch (text.charAt(i)) {
                case '*':
                case '?':
                case '[':
                case '{':
                    return true;
                default:
                    break;
            }
        }
        return false;
    }

    private static List<String> splitSegments(String pattern, String separator) {
        List<String> segments = new ArrayList<>();
        for (String segment : pattern.split(Pattern.quote(separator))) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        return segments;
    }
}
