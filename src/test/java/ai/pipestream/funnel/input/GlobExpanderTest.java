package ai.pipestream.funnel.input;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GlobExpanderTest {

    @TempDir
    Path tempDir;

    private final GlobExpander expander = new GlobExpander();

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(tempDir.resolve("img/2024"));
        Files.writeString(tempDir.resolve("img/a.png"), "a");
        Files.writeString(tempDir.resolve("img/b.jpg"), "b");
        Files.writeString(tempDir.resolve("img/2024/c.png"), "c");
    }

    private String pattern(String relative) {
        return tempDir + "/" + relative;
    }

    private String path(String relative) {
        return tempDir.resolve(relative).toString();
    }

    @Test
    void starMatchesWithinOneDirectory() {
        assertEquals(List.of(path("img/a.png")), expander.expand(pattern("img/*.png")));
    }

    @Test
    void doubleStarDescends() {
        assertEquals(List.of(path("img/2024/c.png")), expander.expand(pattern("img/**/*.png")));
    }

    @Test
    void bracesAndQuestionMark() {
        assertEquals(List.of(path("img/a.png"), path("img/b.jpg")), expander.expand(pattern("img/?.{png,jpg}")));
    }

    @Test
    void directoriesAreNotMatched() {
        assertEquals(List.of(), expander.expand(pattern("img/20*")));
    }

    @Test
    void literalPathIsReturnedOnlyIfItExists() {
        assertEquals(List.of(path("img/a.png")), expander.expand(path("img/a.png")));
        assertEquals(List.of(), expander.expand(path("img/zzz.png")));
    }

    @Test
    void missingBaseDirectoryMatchesNothing() {
        assertEquals(List.of(), expander.expand(pattern("nowhere/*.png")));
    }

    @Test
    void detectsGlobCharacters() {
        assertTrue(GlobExpander.isGlob("*.txt"));
        assertTrue(GlobExpander.isGlob("file?.txt"));
        assertTrue(GlobExpander.isGlob("[ab].txt"));
        assertTrue(GlobExpander.isGlob("{a,b}.txt"));
        assertFalse(GlobExpander.isGlob("plain/file.txt"));
    }
}
