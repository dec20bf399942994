package com.identity.matching.nickname;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NicknameDatasetLoader Tests")
class NicknameDatasetLoaderTest {

    private final NicknameDatasetLoader loader = new NicknameDatasetLoader();

    @Test
    void readsRowsAfterHeaderAndSkipsBlankLines() {
        String csv = """
                name1,relationship,name2
                robert,has_nickname,bob

                "katherine",has_nickname,"kate"
                """;

        List<NicknameRelation> rows = loader.readRows(new StringReader(csv));

        assertEquals(2, rows.size());
        assertEquals(new NicknameRelation("robert", "has_nickname", "bob"), rows.get(0));
        assertEquals(new NicknameRelation("katherine", "has_nickname", "kate"), rows.get(1));
    }

    @Test
    @DisplayName("Short rows and rows without both names are skipped, the rest still load")
    void malformedRowsAreSkipped() {
        String csv = """
                name1,relationship,name2
                robert,has_nickname,bob
                william,has_nickname
                ,has_nickname,liz
                katherine,has_nickname,kate
                """;

        List<NicknameRelation> rows = loader.readRows(new StringReader(csv));
        assertEquals(List.of("robert", "katherine"), rows.stream().map(NicknameRelation::name).toList());

        NicknameIndex index = loader.load(new StringReader(csv), "test");
        assertFalse(index.isDegraded());
        assertTrue(index.areLinked("robert", "bob"));
        assertFalse(index.areLinked("william", "bill"));
    }

    @Test
    @DisplayName("A dataset with no usable row degrades to an empty index without throwing")
    void corruptDatasetDegrades() {
        NicknameIndex index = loader.load(new StringReader("name1,relationship,name2\nrobert;bob\n"), "test");

        assertTrue(index.isDegraded());
        assertTrue(index.isEmpty());
        assertTrue(index.getDegradedReason().contains("no usable rows"));
    }

    @Test
    void emptyDatasetDegrades() {
        NicknameIndex index = loader.load(new StringReader(""), "empty");

        assertTrue(index.isDegraded());
    }

    @Test
    void missingClasspathResourceDegrades() {
        NicknameIndex index = loader.loadFromClasspath("/no-such-nicknames.csv");

        assertTrue(index.isDegraded());
        assertTrue(index.getDegradedReason().contains("/no-such-nicknames.csv"));
    }

    @Test
    void missingFileDegrades(@TempDir Path dir) {
        NicknameIndex index = loader.loadFromPath(dir.resolve("missing.csv"));

        assertTrue(index.isDegraded());
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("nicknames.csv");
        Files.writeString(file, "name1,relationship,name2\nelizabeth,has_nickname,liz\n", StandardCharsets.UTF_8);

        NicknameIndex index = loader.loadFromPath(file);

        assertFalse(index.isDegraded());
        assertTrue(index.areLinked("liz", "elizabeth"));
    }

    @Test
    @DisplayName("The bundled dataset links common nicknames")
    void bundledDatasetLoads() {
        NicknameIndex index = loader.loadDefault();

        assertFalse(index.isDegraded());
        assertFalse(index.isEmpty());
        assertTrue(index.areLinked("robert", "bob"));
        assertTrue(index.areLinked("bill", "william"));
        assertTrue(index.areLinked("bob", "rob"));
    }
}
