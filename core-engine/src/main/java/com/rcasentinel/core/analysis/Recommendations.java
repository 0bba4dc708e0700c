package com.rcasentinel.core.analysis;

import com.rcasentinel.core.model.Anomaly;
import com.rcasentinel.core.model.AnomalyKind;
import com.rcasentinel.core.model.ImpactAnalysis;
import com.rcasentinel.core.model.ImpactSeverity;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the remediation text attached to a root-cause candidate.
 *
 * @since 1.0.0
 */
final class Recommendations {

    static final String SEPARATOR = " | ";

    private Recommendations() {
        // utility class
    }

    static String forCandidate(String service, List<Anomaly> anomalies, ImpactAnalysis impact) {
        List<String> parts = new ArrayList<>();

        Set<AnomalyKind> kinds = EnumSet.noneOf(AnomalyKind.class);
        anomalies.forEach(anomaly -> kinds.add(anomaly.getKind()));
        for (AnomalyKind kind : kinds) {
            parts.add(kind.advice(service));
        }

        int affected = impact.getAffectedServices().size();
        if (affected > 0) {
            parts.add("Prioritise " + service + ": it affects " + affected + " downstream service"
                    + (affected == 1 ? "" : "s"));
        }
        if (impact.getImpactSeverity() == ImpactSeverity.HIGH) {
            parts.add("Act immediately: impact severity is high");
        }

        return parts.isEmpty()
                ? "Investigate the anomalies of " + service + " further"
                : String.join(SEPARATOR, parts);
    }
}
