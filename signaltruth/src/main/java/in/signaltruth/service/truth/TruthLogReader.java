package in.signaltruth.service.truth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.signaltruth.domain.signal.UnitSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Read side of the truth log. Never writes.
 *
 * Lines that are blank, not valid UTF-8, or not a JSON object are skipped. A missing partition
 * is not an error; an unreadable one surfaces as {@link IOException}.
 */
public class TruthLogReader {
    private static final Logger log = LoggerFactory.getLogger(TruthLogReader.class);

    private static final char MALFORMED = '\uFFFD';

    private final Path logDir;
    private final ObjectMapper mapper = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    public TruthLogReader(Path logDir) {
        this.logDir = logDir;
    }

    public Path partition(UnitSystem unitSystem) {
        return logDir.resolve(unitSystem.partitionFileName());
    }

    public boolean exists(UnitSystem unitSystem) {
        return Files.exists(partition(unitSystem));
    }

    /**
     * Last {@code count} records of a partition, oldest first. Empty if the partition is missing.
     */
    public List<JsonNode> tail(UnitSystem unitSystem, int count) throws IOException {
        Deque<JsonNode> window = new ArrayDeque<>();
        if (count <= 0) {
            return List.of();
        }
        forEachRecord(unitSystem, record -> {
            window.addLast(record);
            if (window.size() > count) {
                window.removeFirst();
            }
        });
        return new ArrayList<>(window);
    }

    /**
     * Every record with the given id, across both partitions.
     */
    public List<JsonNode> findBySignalId(String signalId) throws IOException {
        List<JsonNode> matches = new ArrayList<>();
        for (UnitSystem unitSystem : UnitSystem.values()) {
            forEachRecord(unitSystem, record -> {
                if (signalId.equals(record.path("signal_id").asText(null))) {
                    matches.add(record);
                }
            });
        }
        return matches;
    }

    /**
     * All ids present in either partition; used to rebuild the processed set at startup.
     */
    public Set<String> signalIds() throws IOException {
        Set<String> ids = new LinkedHashSet<>();
        for (UnitSystem unitSystem : UnitSystem.values()) {
            forEachRecord(unitSystem, record -> {
                String id = record.path("signal_id").asText(null);
                if (id != null && !id.isBlank()) {
                    ids.add(id);
                }
            });
        }
        return ids;
    }

    private void forEachRecord(UnitSystem unitSystem, Consumer<JsonNode> fn) throws IOException {
        Path file = partition(unitSystem);
        if (!Files.exists(file)) {
            return;
        }
        int skipped = 0;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), lenientUtf8()))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                if (line.indexOf(MALFORMED) >= 0) {
                    skipped++;
                    continue;
                }
                try {
                    JsonNode record = mapper.readTree(line);
                    if (record != null && record.isObject()) {
                        fn.accept(record);
                    } else {
                        skipped++;
                    }
                } catch (JsonProcessingException e) {
                    skipped++;
                }
            }
        }
        if (skipped > 0) {
            log.warn("[TRUTH] Skipped {} unreadable lines in {}", skipped, file);
        }
    }

    // Corrupt bytes become U+FFFD so one damaged line cannot hide the rest of the partition
    private static CharsetDecoder lenientUtf8() {
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    }
}
