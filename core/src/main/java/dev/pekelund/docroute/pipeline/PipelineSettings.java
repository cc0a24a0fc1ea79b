package dev.pekelund.docroute.pipeline;

import dev.pekelund.docroute.analysis.AnalyzerThresholds;
import dev.pekelund.docroute.routing.FailoverSettings;
import dev.pekelund.docroute.tables.TableDetectionSettings;
import java.util.Objects;

/**
 * Complete, immutable configuration of a pipeline instance.
 */
public record PipelineSettings(
    AnalyzerThresholds analyzerThresholds,
    FailoverSettings failoverSettings,
    TableDetectionSettings tableDetectionSettings
) {

    /**
     * Minimum rows used for fallback table detection inside the pipeline.
     */
    public static final int PIPELINE_TABLE_MIN_ROWS = 2;

    public PipelineSettings {
        Objects.requireNonNull(analyzerThresholds, "analyzerThresholds");
        Objects.requireNonNull(failoverSettings, "failoverSettings");
        Objects.requireNonNull(tableDetectionSettings, "tableDetectionSettings");
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(AnalyzerThresholds.defaults(), FailoverSettings.defaults(),
            TableDetectionSettings.defaults().withMinRows(PIPELINE_TABLE_MIN_ROWS));
    }
}
