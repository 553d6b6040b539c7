package in.signaltruth.cli;

import com.fasterxml.jackson.databind.JsonNode;
import in.signaltruth.domain.signal.UnitSystem;
import in.signaltruth.service.truth.TruthLogReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Read-only console view of the truth log.
 *
 * Exit codes: 0 success (including a partition that does not exist yet), 1 a partition
 * exists but cannot be read, 2 bad arguments.
 */
public final class TruthLogInspector {
    private static final Logger log = LoggerFactory.getLogger(TruthLogInspector.class);

    public static final int DEFAULT_COUNT = 3;
    public static final int EXIT_OK = 0;
    public static final int EXIT_UNREADABLE = 1;
    public static final int EXIT_USAGE = 2;

    private static final String ROW_FORMAT = "%-30s %-10s %-4s %-8s %-12s %10s %9s  %-18s%n";
    private static final String RULE = "=".repeat(110);

    private final TruthLogReader reader;
    private final PrintStream out;

    public TruthLogInspector(TruthLogReader reader, PrintStream out) {
        this.reader = reader;
        this.out = out;
    }

    /**
     * Entry point for {@code inspect [count] [forex|crypto|both]}.
     */
    public int run(String[] args) {
        int count = DEFAULT_COUNT;
        String type = "both";
        try {
            if (args.length > 0) {
                count = Integer.parseInt(args[0]);
            }
        } catch (NumberFormatException e) {
            out.println("Invalid count: " + args[0]);
            return usage();
        }
        if (args.length > 1) {
            type = args[1];
        }
        if (count <= 0) {
            out.println("Count must be positive: " + count);
            return usage();
        }
        List<UnitSystem> partitions = partitionsFor(type);
        if (partitions == null) {
            out.println("Unknown type: " + type);
            return usage();
        }
        return inspect(count, partitions);
    }

    public int inspect(int count, List<UnitSystem> partitions) {
        List<JsonNode> rows = new ArrayList<>();
        int exitCode = EXIT_OK;
        for (UnitSystem unitSystem : partitions) {
            if (!reader.exists(unitSystem)) {
                out.println("No readable log for " + unitSystem.code() + " at " + reader.partition(unitSystem));
                continue;
            }
            try {
                rows.addAll(reader.tail(unitSystem, count));
            } catch (IOException e) {
                log.error("Truth log inspection error for {}: {}", reader.partition(unitSystem), e.getMessage());
                out.println("Truth log is not readable: " + reader.partition(unitSystem) + " (" + e.getMessage() + ")");
                exitCode = EXIT_UNREADABLE;
            }
        }

        rows.sort(Comparator.comparing(TruthLogInspector::completedAt));
        if (rows.size() > count) {
            rows = new ArrayList<>(rows.subList(rows.size() - count, rows.size()));
        }

        if (rows.isEmpty()) {
            out.println("Truth log is empty - no entries to display");
            return exitCode;
        }
        out.printf("%nTRUTH LOG - latest %d entries%n", rows.size());
        renderTable(rows);
        renderSummary(rows);
        return exitCode;
    }

    // Rows without a parseable completion time sort first
    private static Instant completedAt(JsonNode row) {
        try {
            return Instant.parse(row.path("completed_at").asText(""));
        } catch (DateTimeParseException e) {
            return Instant.MIN;
        }
    }

    /**
     * Entry point for {@code inspect-signal <id>}.
     */
    public int inspectSignal(String signalId) {
        List<JsonNode> matches;
        try {
            matches = reader.findBySignalId(signalId);
        } catch (IOException e) {
            log.error("Truth log inspection error: {}", e.getMessage());
            out.println("Truth log is not readable: " + e.getMessage());
            return EXIT_UNREADABLE;
        }
        if (matches.isEmpty()) {
            out.println("No truth log entry for " + signalId);
            return EXIT_OK;
        }
        for (JsonNode match : matches) {
            out.println(match.toPrettyString());
        }
        return EXIT_OK;
    }

    private void renderTable(List<JsonNode> rows) {
        out.println(RULE);
        out.printf(ROW_FORMAT, "Signal ID", "Symbol", "Dir", "Result", "Exit", "Delta", "Runtime", "Source");
        out.println("-".repeat(110));
        for (JsonNode row : rows) {
            String id = row.path("signal_id").asText("unknown");
            if (id.length() > 29) {
                id = id.substring(0, 29);
            }
            out.printf(ROW_FORMAT,
                id,
                row.path("symbol").asText("N/A"),
                row.path("direction").asText("N/A"),
                row.path("result").asText("N/A"),
                row.path("exit_type").asText("N/A"),
                formatDelta(row),
                formatRuntime(row.path("runtime_minutes")),
                row.path("source").asText("unknown"));
        }
        out.println(RULE);
    }

    private void renderSummary(List<JsonNode> rows) {
        int wins = 0;
        int losses = 0;
        int timeouts = 0;
        BigDecimal pips = BigDecimal.ZERO;
        BigDecimal usd = BigDecimal.ZERO;
        for (JsonNode row : rows) {
            switch (row.path("result").asText("")) {
                case "WIN" -> wins++;
                case "LOSS" -> losses++;
                case "TIMEOUT" -> timeouts++;
                default -> { }
            }
            JsonNode delta = row.path("delta");
            if (delta.isNumber()) {
                if (UnitSystem.CRYPTO.code().equals(row.path("unit_system").asText())) {
                    usd = usd.add(delta.decimalValue());
                } else {
                    pips = pips.add(delta.decimalValue());
                }
            }
        }
        double winRate = wins * 100.0 / rows.size();
        out.printf(Locale.ROOT, "SUMMARY: %d wins, %d losses, %d timeouts, %.1f%% win rate, %+.1f total pips, %+.2f total usd%n",
            wins, losses, timeouts, winRate, pips, usd);
    }

    private static String formatDelta(JsonNode row) {
        JsonNode delta = row.path("delta");
        if (!delta.isNumber()) {
            return "N/A";
        }
        boolean crypto = UnitSystem.CRYPTO.code().equals(row.path("unit_system").asText());
        return crypto
            ? String.format(Locale.ROOT, "%+.2f$", delta.decimalValue())
            : String.format(Locale.ROOT, "%+.1fp", delta.decimalValue());
    }

    private static String formatRuntime(JsonNode minutes) {
        return minutes.isNumber() ? String.format(Locale.ROOT, "%.1fm", minutes.doubleValue()) : "N/A";
    }

    private static List<UnitSystem> partitionsFor(String type) {
        if ("both".equalsIgnoreCase(type)) {
            return List.of(UnitSystem.values());
        }
        return UnitSystem.fromCode(type).map(List::of).orElse(null);
    }

    private int usage() {
        out.println("Usage: inspect [count] [forex|crypto|both]");
        out.println("       inspect-signal <signal_id>");
        return EXIT_USAGE;
    }
}
