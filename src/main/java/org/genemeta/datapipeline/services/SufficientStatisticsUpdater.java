package org.genemeta.datapipeline.services;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.genemeta.datapipeline.api.resources.database.IAggregationSession;
import org.genemeta.datapipeline.api.resources.database.dto.LedgerEntry;
import org.genemeta.datapipeline.api.resources.database.dto.MetricKind;
import org.genemeta.datapipeline.api.resources.database.dto.PerStudyComponent;
import org.genemeta.datapipeline.api.resources.database.dto.StatisticsKey;
import org.genemeta.datapipeline.api.resources.database.dto.SufficientStatistics;
import org.genemeta.datapipeline.api.resources.database.dto.SufficientStatistics.ApplyOutcome;
import org.genemeta.datapipeline.api.resources.database.dto.ValidationCode;
import org.genemeta.datapipeline.api.resources.database.dto.ValidationWarning;
import org.genemeta.datapipeline.statistics.FisherZTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds one study's components into the sufficient-statistics rows of one aggregation attempt.
 * <p>
 * Every component is validated first. Invalid contributions are skipped with a
 * {@link ValidationWarning} and never touch the sums; if the study already contributed to the
 * row, its previous contribution stays in place. A valid contribution replaces the study's earlier
 * one in the row's ledger, so each study is counted once per row. Within one attempt only the
 * first valid component of a study for a row counts; repeats, e.g. the same pair in both gene
 * orders, are skipped as {@link ValidationCode#DUPLICATE_COMPONENT}.
 * <p>
 * Rows are loaded once per attempt and written back by {@link #persistChanged()}; nothing is
 * visible to other runs before the session commits.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe; bound to one session.
 */
public class SufficientStatisticsUpdater {

    private static final Logger log = LoggerFactory.getLogger(SufficientStatisticsUpdater.class);

    private final IAggregationSession session;
    private final int minCorrelationN;
    private final String featureRunId;
    private final Map<StatisticsKey, SufficientStatistics> loaded = new LinkedHashMap<>();
    private final Set<StatisticsKey> changed = new LinkedHashSet<>();
    private final Map<StatisticsKey, Set<Integer>> foldedStudies = new HashMap<>();
    private final List<ValidationWarning> warnings = new ArrayList<>();
    private int applied;
    private int unchanged;
    private int skipped;

    public SufficientStatisticsUpdater(IAggregationSession session, int minCorrelationN, String featureRunId) {
        this.session = session;
        this.minCorrelationN = minCorrelationN;
        this.featureRunId = featureRunId;
    }

    /**
     * Validates a component and folds it into the row of {@code key}.
     *
     * @param component The study's estimate.
     * @param key       Resolved row key.
     * @return The outcome, or empty if the component was skipped with a warning.
     * @throws SQLException if the row cannot be loaded.
     */
    public Optional<ApplyOutcome> fold(PerStudyComponent component, StatisticsKey key) throws SQLException {
        Optional<LedgerEntry> entry = toLedgerEntry(component);
        if (entry.isEmpty()) {
            skipped++;
            return Optional.empty();
        }

        SufficientStatistics statistics = load(key, component.kind());
        if (statistics.getMetricKind() != component.kind()) {
            warn(component, ValidationCode.METRIC_KIND_MISMATCH, String.format(
                "metric '%s' is pooled as %s but the component is %s",
                key.metricName(), statistics.getMetricKind(), component.kind()));
            skipped++;
            return Optional.empty();
        }
        if (!foldedStudies.computeIfAbsent(key, k -> new HashSet<>()).add(component.studyKey())) {
            warn(component, ValidationCode.DUPLICATE_COMPONENT, String.format(
                "study already supplied metric '%s' for pair %d in this run", key.metricName(), key.pairKey()));
            skipped++;
            return Optional.empty();
        }

        ApplyOutcome outcome = statistics.apply(entry.get());
        if (outcome == ApplyOutcome.UNCHANGED) {
            unchanged++;
        } else {
            applied++;
            changed.add(key);
        }
        log.debug("Study {} {} {} on {} (k={})", component.studyKey(), outcome, key.metricName(), key,
            statistics.getStudyCount());
        return Optional.of(outcome);
    }

    /**
     * Writes every changed row back through the session.
     *
     * @return The changed rows, in the order they were first touched.
     * @throws SQLException if a write fails or another writer changed a row meanwhile.
     */
    public List<SufficientStatistics> persistChanged() throws SQLException {
        List<SufficientStatistics> written = new ArrayList<>(changed.size());
        for (StatisticsKey key : changed) {
            SufficientStatistics statistics = loaded.get(key);
            session.saveStatistics(statistics);
            written.add(statistics);
        }
        return written;
    }

    private SufficientStatistics load(StatisticsKey key, MetricKind kind) throws SQLException {
        SufficientStatistics statistics = loaded.get(key);
        if (statistics == null) {
            statistics = session.loadStatistics(key).orElseGet(() -> SufficientStatistics.empty(key, kind));
            loaded.put(key, statistics);
        }
        return statistics;
    }

    /**
     * Converts a component to a ledger entry, or records why it cannot contribute.
     * <p>
     * Effect sizes need a finite estimate and a positive, finite standard error. Correlations
     * need {@code |r| < 1} and at least {@code minCorrelationN} samples; they are stored on the
     * Fisher-z scale with weight {@code n − 3}.
     */
    Optional<LedgerEntry> toLedgerEntry(PerStudyComponent component) {
        if (!Double.isFinite(component.value())) {
            warn(component, ValidationCode.NON_FINITE_ESTIMATE, "estimate is " + component.value());
            return Optional.empty();
        }

        if (component.kind() == MetricKind.CORRELATION) {
            double r = component.value();
            if (Math.abs(r) >= 1.0) {
                warn(component, ValidationCode.CORRELATION_OUT_OF_RANGE, "r=" + r + " outside (-1, 1)");
                return Optional.empty();
            }
            Integer n = component.nSamples();
            if (n == null || n < minCorrelationN) {
                warn(component, ValidationCode.CORRELATION_SAMPLE_TOO_SMALL,
                    "n=" + n + " below minimum " + minCorrelationN);
                return Optional.empty();
            }
            double se = FisherZTransform.standardError(n);
            return Optional.of(new LedgerEntry(component.studyKey(), n - 3.0, FisherZTransform.toZ(r), se, n,
                featureRunId));
        }

        Double se = component.standardError();
        if (se == null || !Double.isFinite(se) || se <= 0.0) {
            warn(component, ValidationCode.NON_POSITIVE_STANDARD_ERROR, "standard_error=" + se);
            return Optional.empty();
        }
        double weight = 1.0 / (se * se);
        if (!Double.isFinite(weight)) {
            warn(component, ValidationCode.NON_POSITIVE_STANDARD_ERROR,
                "standard_error=" + se + " too small for a finite weight");
            return Optional.empty();
        }
        return Optional.of(new LedgerEntry(component.studyKey(), weight, component.value(), se,
            component.nSamples(), featureRunId));
    }

    private void warn(PerStudyComponent component, ValidationCode code, String details) {
        log.warn("Skipping contribution of study {} to pair '{}' metric '{}': {} ({})",
            component.studyKey(), component.pairId(), component.metricName(), code, details);
        warnings.add(new ValidationWarning(featureRunId, component.studyKey(), component.pairId(),
            component.metricName(), code, details));
    }

    public List<ValidationWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public int getAppliedCount() {
        return applied;
    }

    public int getUnchangedCount() {
        return unchanged;
    }

    public int getSkippedCount() {
        return skipped;
    }
}
