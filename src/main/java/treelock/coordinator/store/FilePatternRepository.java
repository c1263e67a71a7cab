package treelock.coordinator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.model.PatternEntry;
import treelock.coordinator.repository.PatternRepository;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON-lines implementation of PatternRepository.
 * Each line is {@code {"antecedent":[...],"successor":"..."}}.
 */
public class FilePatternRepository implements PatternRepository {

    private static final Logger log = LoggerFactory.getLogger(FilePatternRepository.class);

    public static final String FILE_NAME = "lock-patterns.log";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path file;

    public FilePatternRepository(Path dataDir) {
        this.file = dataDir.resolve(FILE_NAME);
    }

    public Path file() {
        return file;
    }

    record Observation(List<String> antecedent, String successor) {
    }

    @Override
    public synchronized void append(List<String> antecedent, String successor) {
        try {
            Files.createDirectories(file.getParent());
            String line = MAPPER.writeValueAsString(new Observation(antecedent, successor));
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append pattern to " + file, e);
        }
    }

    @Override
    public List<PatternEntry> loadAll() {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<PatternEntry> observations = new ArrayList<>();
        int malformed = 0;
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    Observation obs = MAPPER.readValue(line, Observation.class);
                    if (obs.antecedent() == null || obs.successor() == null) {
                        malformed++;
                        continue;
                    }
                    observations.add(new PatternEntry(obs.antecedent(), obs.successor(), 1, 1));
                } catch (JsonProcessingException e) {
                    malformed++;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read patterns from " + file, e);
        }
        if (malformed > 0) {
            log.warn("Skipped {} malformed pattern line(s) in {}", malformed, file);
        }
        return observations;
    }
}
