package in.signaltruth.service.ingestion;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.signaltruth.application.port.output.SignalSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Signal source that watches a directory written by the upstream generators.
 *
 * File name conventions:
 * - mission_*.json      main generator missions
 * - 5_*_USER*.json      per-user mission copies
 *
 * A file name is remembered once it parses as a JSON object. Files that fail to read or
 * parse are retried on every scan, since a generator may still be writing them; the first
 * failure is logged at ERROR, repeats at DEBUG. Not thread-safe: only the ingestion loop
 * calls {@link #pollNew()}.
 */
public class DirectorySignalSource implements SignalSource {
    private static final Logger log = LoggerFactory.getLogger(DirectorySignalSource.class);

    static final List<String> FILE_PATTERNS = List.of("mission_*.json", "5_*_USER*.json");

    private final Path directory;
    private final ObjectMapper mapper;
    private final Set<String> seenFiles = new HashSet<>();
    private final Set<String> failingFiles = new HashSet<>();
    private boolean missingDirectoryReported = false;

    public DirectorySignalSource(Path directory) {
        this.directory = directory;
        this.mapper = new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    @Override
    public List<SignalDocument> pollNew() {
        if (!Files.isDirectory(directory)) {
            if (!missingDirectoryReported) {
                log.warn("[INGEST] Signals folder {} does not exist", directory);
                missingDirectoryReported = true;
            }
            return List.of();
        }
        missingDirectoryReported = false;

        List<SignalDocument> documents = new ArrayList<>();
        for (Path file : listCandidates()) {
            String name = file.getFileName().toString();
            if (seenFiles.contains(name)) {
                continue;
            }
            try {
                JsonNode body = mapper.readTree(file.toFile());
                if (body == null || !body.isObject()) {
                    reportFailure(name, "not a JSON object");
                    continue;
                }
                Instant modifiedAt = Files.getLastModifiedTime(file).toInstant();
                seenFiles.add(name);
                failingFiles.remove(name);
                documents.add(new SignalDocument(name, body, modifiedAt));
            } catch (IOException e) {
                reportFailure(name, e.getMessage());
            }
        }
        return documents;
    }

    /**
     * Number of file names remembered so far.
     */
    public int seenCount() {
        return seenFiles.size();
    }

    private void reportFailure(String name, String reason) {
        if (failingFiles.add(name)) {
            log.error("[INGEST] Error loading signal file {} (will retry): {}", name, reason);
        } else {
            log.debug("[INGEST] Signal file {} still unreadable: {}", name, reason);
        }
    }

    private Set<Path> listCandidates() {
        // Sorted so files are admitted in a stable order
        Set<Path> files = new TreeSet<>();
        for (String pattern : FILE_PATTERNS) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, pattern)) {
                for (Path file : stream) {
                    if (Files.isRegularFile(file)) {
                        files.add(file);
                    }
                }
            } catch (IOException e) {
                log.error("[INGEST] Failed to list {} in {}: {}", pattern, directory, e.getMessage());
            }
        }
        return files;
    }
}
