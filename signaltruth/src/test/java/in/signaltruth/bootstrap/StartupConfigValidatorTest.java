package in.signaltruth.bootstrap;

import in.signaltruth.config.TrackerConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Startup Config Validator")
public class StartupConfigValidatorTest {

    @TempDir
    Path dir;

    private TrackerConfig config(Path truthLogDir, String url) {
        return new TrackerConfig(dir.resolve("missions"), truthLogDir, url, dir.resolve("state.json"),
            Duration.ofSeconds(2), Duration.ofSeconds(1), Duration.ofSeconds(5), Duration.ofHours(24),
            Duration.ofSeconds(60), 0, true);
    }

    @Test
    @DisplayName("Valid configuration passes and creates the log directory")
    public void testValid() {
        Path logs = dir.resolve("logs");

        assertDoesNotThrow(() -> StartupConfigValidator.validate(config(logs, "http://localhost:8001/market-data")));
        assertTrue(Files.isDirectory(logs));
    }

    @Test
    @DisplayName("Invalid market data URL refuses to start")
    public void testBadUrl() {
        assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(config(dir.resolve("logs"), "localhost:8001")));
    }

    @Test
    @DisplayName("Log directory that cannot be created refuses to start")
    public void testBlockedLogDir() throws IOException {
        Path blocked = dir.resolve("blocked");
        Files.writeString(blocked, "not a directory");

        assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(config(blocked, "http://localhost:8001")));
    }
}
