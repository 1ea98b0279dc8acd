package org.lsst.fits.redshift;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.lsst.fits.redshift.correlate.CorrelationResult;

/**
 * Everything produced by matching one spectrum: the correlation curve of each
 * template, the fitted candidates strongest first, and the templates whose
 * fits failed.
 */
public class MatchResults {

    private final Map<String, CorrelationResult> correlations;
    private final List<RedshiftCandidate> candidates;
    private final Map<String, NoMatchException> failures;

    public MatchResults(Map<String, CorrelationResult> correlations, List<RedshiftCandidate> candidates, Map<String, NoMatchException> failures) {
        this.correlations = Collections.unmodifiableMap(new LinkedHashMap<>(correlations));
        List<RedshiftCandidate> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingDouble(RedshiftCandidate::getValue).reversed());
        this.candidates = Collections.unmodifiableList(sorted);
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public Map<String, CorrelationResult> getCorrelations() {
        return correlations;
    }

    public List<RedshiftCandidate> getCandidates() {
        return candidates;
    }

    public Map<String, NoMatchException> getFailures() {
        return failures;
    }

    /**
     * The candidate with the strongest correlation, if any template matched.
     */
    public Optional<RedshiftCandidate> getBest() {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    @Override
    public String toString() {
        return "MatchResults{" + "templates=" + correlations.size() + ", candidates=" + candidates.size() + ", failures=" + failures.keySet() + '}';
    }
}
