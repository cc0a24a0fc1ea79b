package dev.pekelund.docroute.extractor;

import dev.pekelund.docroute.analysis.AnalyzerThresholds;
import dev.pekelund.docroute.pipeline.PipelineSettings;
import dev.pekelund.docroute.routing.FailoverSettings;
import dev.pekelund.docroute.tables.TableDetectionSettings;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Resolves {@link PipelineSettings} from {@code DOCROUTE_*} environment variables. Unset variables keep
 * the pipeline defaults.
 */
public final class DocumentPipelineSettings {

    static final String MIN_NUMBERS_PER_PAGE = "DOCROUTE_MIN_NUMBERS_PER_PAGE";
    static final String MIN_NUMBER_DENSITY = "DOCROUTE_MIN_NUMBER_DENSITY";
    static final String MIN_TABLE_LIKENESS = "DOCROUTE_MIN_TABLE_LIKENESS";
    static final String MAX_PAGES_PER_GROUP = "DOCROUTE_MAX_PAGES_PER_GROUP";
    static final String AI_ENABLED = "DOCROUTE_AI_ENABLED";
    static final String USE_VISION = "DOCROUTE_USE_VISION";
    static final String MAX_CONCURRENT_GROUPS = "DOCROUTE_MAX_CONCURRENT_GROUPS";
    static final String GROUP_TIMEOUT_SECONDS = "DOCROUTE_GROUP_TIMEOUT_SECONDS";
    static final String TABLE_MIN_ROWS = "DOCROUTE_TABLE_MIN_ROWS";
    static final String TABLE_MIN_COLS = "DOCROUTE_TABLE_MIN_COLS";
    static final String TABLE_X_TOLERANCE = "DOCROUTE_TABLE_X_TOLERANCE";

    private DocumentPipelineSettings() {
    }

    public static PipelineSettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * @throws IllegalStateException when a variable is set to a value that cannot be parsed or is out of range
     */
    public static PipelineSettings fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        PipelineSettings defaults = PipelineSettings.defaults();

        AnalyzerThresholds analyzer = defaults.analyzerThresholds();
        FailoverSettings failover = defaults.failoverSettings();
        TableDetectionSettings tables = defaults.tableDetectionSettings();

        try {
            analyzer = new AnalyzerThresholds(
                intValue(env, MIN_NUMBERS_PER_PAGE, analyzer.minNumbersPerPage()),
                doubleValue(env, MIN_NUMBER_DENSITY, analyzer.minNumberDensity()),
                doubleValue(env, MIN_TABLE_LIKENESS, analyzer.minTableLikenessScore()),
                intValue(env, MAX_PAGES_PER_GROUP, analyzer.maxPagesPerGroup()));
            failover = new FailoverSettings(
                booleanValue(env, AI_ENABLED, failover.enabled()),
                booleanValue(env, USE_VISION, failover.useVisionIfAvailable()),
                intValue(env, MAX_CONCURRENT_GROUPS, failover.maxConcurrentGroups()),
                Duration.ofSeconds(intValue(env, GROUP_TIMEOUT_SECONDS, (int) failover.groupTimeout().toSeconds())));
            tables = new TableDetectionSettings(
                intValue(env, TABLE_MIN_ROWS, tables.minRows()),
                intValue(env, TABLE_MIN_COLS, tables.minCols()),
                doubleValue(env, TABLE_X_TOLERANCE, tables.xTolerance()));
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("Invalid DOCROUTE_* configuration: " + ex.getMessage(), ex);
        }
        return new PipelineSettings(analyzer, failover, tables);
    }

    private static int intValue(Map<String, String> env, String name, int defaultValue) {
        String value = env.get(name);
        if (!StringUtils.hasText(value)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(name + " must be an integer but was '" + value + "'", ex);
        }
    }

    private static double doubleValue(Map<String, String> env, String name, double defaultValue) {
        String value = env.get(name);
        if (!StringUtils.hasText(value)) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(name + " must be a number but was '" + value + "'", ex);
        }
    }

    private static boolean booleanValue(Map<String, String> env, String name, boolean defaultValue) {
        String value = env.get(name);
        if (!StringUtils.hasText(value)) {
            return defaultValue;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "true", "1", "yes" -> true;
            case "false", "0", "no" -> false;
            default -> throw new IllegalStateException(name + " must be true or false but was '" + value + "'");
        };
    }
}
