package com.identity.matching.nickname;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the nickname dataset into a {@link NicknameIndex}.
 *
 * <p>Expected CSV format:</p>
 * <pre>
 * name1,relationship,name2
 * robert,has_nickname,bob
 * robert,has_nickname,rob
 * </pre>
 *
 * <p>The first line is a header. Blank lines are skipped. A non-blank line
 * with fewer than three fields makes the whole dataset corrupt.</p>
 *
 * <p>The {@code load*} methods never throw: a missing or corrupt dataset is
 * logged and yields a degraded, empty index so that matching can proceed
 * without nickname links.</p>
 */
public class NicknameDatasetLoader {
    private static final Logger log = LoggerFactory.getLogger(NicknameDatasetLoader.class);

    public static final String DEFAULT_RESOURCE = "/nicknames.csv";

    /**
     * Loads the dataset bundled with the library.
     */
    public NicknameIndex loadDefault() {
        return loadFromClasspath(DEFAULT_RESOURCE);
    }

    public NicknameIndex loadFromClasspath(String resource) {
        InputStream input = NicknameDatasetLoader.class.getResourceAsStream(resource);
        if (input == null) {
            return degrade(new NicknameDatasetException("Nickname dataset not found on classpath: " + resource));
        }
        return load(new InputStreamReader(input, StandardCharsets.UTF_8), resource);
    }

    public NicknameIndex loadFromPath(Path path) {
        try {
            return load(Files.newBufferedReader(path, StandardCharsets.UTF_8), path.toString());
        } catch (IOException e) {
            return degrade(new NicknameDatasetException("Nickname dataset cannot be opened: " + path, e));
        }
    }

    /**
     * Loads the dataset from a reader, which is closed afterwards.
     *
     * @param reader the CSV content
     * @param source a label for log messages
     */
    public NicknameIndex load(Reader reader, String source) {
        try {
            List<NicknameRelation> rows = readRows(reader);
            log.debug("nickname.dataset.read source={} rows={}", source, rows.size());
            return NicknameIndex.load(rows);
        } catch (NicknameDatasetException e) {
            return degrade(e);
        }
    }

    /**
     * Parses all rows of the dataset.
     *
     * Rows with fewer than three fields or an empty name are skipped with a warning.
     *
     * @throws NicknameDatasetException if the content is empty or unreadable, or no row is usable
     */
    public List<NicknameRelation> readRows(Reader reader) {
        List<NicknameRelation> rows = new ArrayList<>();
        int skipped = 0;
        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String header = br.readLine();
            if (header == null) {
                throw new NicknameDatasetException("Nickname dataset is empty");
            }

            String line;
            long lineNumber = 1;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                NicknameRelation row = parseRow(line);
                if (row == null) {
                    log.warn("nickname.dataset.row.skipped line={} content='{}'", lineNumber, line);
                    skipped++;
                    continue;
                }
                rows.add(row);
            }
        } catch (IOException | UncheckedIOException e) {
            throw new NicknameDatasetException("Nickname dataset cannot be read: " + e.getMessage(), e);
        }
        if (rows.isEmpty() && skipped > 0) {
            throw new NicknameDatasetException("Nickname dataset has no usable rows (" + skipped + " malformed)");
        }
        return rows;
    }

    private NicknameRelation parseRow(String line) {
        String[] fields = line.split(",", -1);
        if (fields.length < 3) {
            return null;
        }
        String name1 = parseField(fields[0]);
        String name2 = parseField(fields[2]);
        if (name1.isEmpty() || name2.isEmpty()) {
            return null;
        }
        return new NicknameRelation(name1, parseField(fields[1]), name2);
    }

    private NicknameIndex degrade(NicknameDatasetException e) {
        log.warn("nickname.dataset.unavailable reason='{}' - name matching continues without nickname links",
                e.getMessage());
        return NicknameIndex.degraded(e.getMessage());
    }

    private String parseField(String field) {
        String trimmed = field.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1).replace("\"\"", "\"");
        }
        return trimmed;
    }
}
