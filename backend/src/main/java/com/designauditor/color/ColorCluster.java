package com.designauditor.color;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One canonical color and every observation folded into it. Members keep their
 * original (normalized) hex so the canonical key can be recomputed at any time.
 */
public record ColorCluster(
    String canonicalHex,
    List<ColorObservation> instances,
    SortedSet<String> mergedHexes
) {
    public ColorCluster {
        instances = List.copyOf(instances);
        TreeSet<String> merged = new TreeSet<>(mergedHexes == null ? Set.of() : mergedHexes);
        merged.remove(canonicalHex);
        mergedHexes = Collections.unmodifiableSortedSet(merged);
    }

    @JsonProperty("count")
    public int count() {
        return instances.size();
    }

    @JsonIgnore
    public Set<ColorUsage> usages() {
        EnumSet<ColorUsage> usages = EnumSet.noneOf(ColorUsage.class);
        for (ColorObservation observation : instances) {
            if (observation.usedAs() != null) {
                usages.add(observation.usedAs());
            }
        }
        return usages;
    }

    @JsonIgnore
    public Map<String, Integer> hexCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ColorObservation observation : instances) {
            counts.merge(observation.hex(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Picks the canonical key by majority of original hexes. Equal counts go to the
     * hex seen on the most important element; a full tie keeps the current key when it
     * is among the tied, otherwise the lowest hex.
     */
    public ColorCluster rekey() {
        Map<String, Integer> counts = hexCounts();
        Map<String, Integer> bestScores = new LinkedHashMap<>();
        for (ColorObservation observation : instances) {
            int score = ElementImportance.of(observation.elementTag()).score();
            bestScores.merge(observation.hex(), score, Math::max);
        }

        String winner = null;
        for (String hex : new TreeSet<>(counts.keySet())) {
            if (winner == null || beats(hex, winner, counts, bestScores)) {
                winner = hex;
            }
        }
        if (winner == null) {
            return this;
        }
        TreeSet<String> merged = new TreeSet<>(counts.keySet());
        merged.add(canonicalHex);
        merged.remove(winner);
        return new ColorCluster(winner, instances, merged);
    }

    private boolean beats(String candidate, String current, Map<String, Integer> counts, Map<String, Integer> bestScores) {
        int byCount = Integer.compare(counts.get(candidate), counts.get(current));
        if (byCount != 0) {
            return byCount > 0;
        }
        int byScore = Integer.compare(bestScores.get(candidate), bestScores.get(current));
        if (byScore != 0) {
            return byScore > 0;
        }
        return candidate.equals(canonicalHex);
    }
}
