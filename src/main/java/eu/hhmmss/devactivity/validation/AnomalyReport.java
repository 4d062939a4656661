package eu.hhmmss.devactivity.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Counts of every anomaly found in one run, with a bounded number of examples per kind.
 */
@Value
public class AnomalyReport {

    Map<AnomalyKind, Integer> counts;
    Map<AnomalyKind, List<ParseAnomaly>> examples;

    /**
     * Summarise the given anomalies.
     *
     * @param anomalies    every anomaly found, in source order
     * @param exampleLimit maximum number of examples kept per kind
     */
    public static AnomalyReport of(Collection<ParseAnomaly> anomalies, int exampleLimit) {
        Map<AnomalyKind, Integer> counts = new EnumMap<>(AnomalyKind.class);
        Map<AnomalyKind, List<ParseAnomaly>> examples = new EnumMap<>(AnomalyKind.class);

        for (ParseAnomaly anomaly : anomalies) {
            counts.merge(anomaly.getKind(), 1, Integer::sum);
            List<ParseAnomaly> kept = examples.computeIfAbsent(anomaly.getKind(), k -> new ArrayList<>());
            if (kept.size() < exampleLimit) {
                kept.add(anomaly);
            }
        }

        examples.replaceAll((kind, list) -> Collections.unmodifiableList(list));
        return new AnomalyReport(Collections.unmodifiableMap(counts), Collections.unmodifiableMap(examples));
    }

    public static AnomalyReport empty() {
        return of(List.of(), 0);
    }

    public int count(AnomalyKind kind) {
        return counts.getOrDefault(kind, 0);
    }

    public int getTotal() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    @JsonIgnore
    public boolean isClean() {
        return counts.isEmpty();
    }
}
