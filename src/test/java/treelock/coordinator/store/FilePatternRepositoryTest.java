package treelock.coordinator.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import treelock.coordinator.model.PatternEntry;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilePatternRepositoryTest {

    @TempDir
    Path dataDir;

    @Test
    void appendsJsonLinesAndLoadsThemBack() throws Exception {
        FilePatternRepository repo = new FilePatternRepository(dataDir);
        repo.append(List.of("add", "commit"), "push");
        repo.append(List.of("add", "commit"), "status");

        List<String> lines = Files.readAllLines(repo.file(), StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("\"successor\":\"push\""), lines.get(0));

        List<PatternEntry> loaded = repo.loadAll();
        assertEquals(2, loaded.size());
        assertEquals(List.of("add", "commit"), loaded.get(0).antecedent());
        assertEquals("push", loaded.get(0).successor());
        assertEquals(1, loaded.get(0).observedCount());
    }

    @Test
    void skipsMalformedLines() throws Exception {
        FilePatternRepository repo = new FilePatternRepository(dataDir);
        repo.append(List.of("fetch"), "merge");
        Files.writeString(repo.file(), "{broken\n{\"antecedent\":[\"x\"]}\n", StandardCharsets.UTF_8,
                StandardOpenOption.APPEND);

        List<PatternEntry> loaded = repo.loadAll();
        assertEquals(1, loaded.size());
        assertEquals("merge", loaded.get(0).successor());
    }

    @Test
    void missingFileLoadsNothing() {
        assertTrue(new FilePatternRepository(dataDir).loadAll().isEmpty());
    }
}
