package com.designauditor.color;

import com.designauditor.config.AuditorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

@Component
public class ColorConsolidationEngine {
    private static final Logger log = LoggerFactory.getLogger(ColorConsolidationEngine.class);

    private final AuditorProperties.Color settings;

    public ColorConsolidationEngine(AuditorProperties properties) {
        this.settings = properties.getColor();
    }

    /**
     * Clusters observations whose colors sit within the merge threshold of each other and
     * re-keys every cluster by majority. Distinct hexes are binned most-used first so the
     * result does not depend on input order. Malformed colors are counted and dropped.
     */
    public ColorTable consolidate(Collection<ColorObservation> observations) {
        if (observations == null || observations.isEmpty()) {
            return ColorTable.empty();
        }
        List<ColorObservation> valid = new ArrayList<>();
        Map<String, Integer> hexCounts = new HashMap<>();
        int malformed = 0;
        for (ColorObservation observation : observations) {
            if (observation == null) {
                malformed++;
                continue;
            }
            String hex = ColorValues.normalizeHex(observation.hex()).orElse(null);
            if (hex == null) {
                malformed++;
                continue;
            }
            valid.add(observation.withHex(hex));
            hexCounts.merge(hex, 1, Integer::sum);
        }
        if (malformed > 0) {
            log.debug("Dropped {} malformed color values out of {}", malformed, observations.size());
        }

        List<String> binningOrder = new ArrayList<>(hexCounts.keySet());
        binningOrder.sort(
            Comparator.comparing((String hex) -> hexCounts.get(hex)).reversed()
                .thenComparing(Comparator.naturalOrder())
        );

        List<Bin> bins = new ArrayList<>();
        Map<String, Bin> binByHex = new HashMap<>();
        for (String hex : binningOrder) {
            Rgb rgb = ColorValues.parse(hex).orElseThrow();
            Bin nearest = null;
            double nearestDistance = Double.MAX_VALUE;
            for (Bin bin : bins) {
                double distance = ColorMath.redmeanDistance(rgb, bin.seed);
                if (distance < nearestDistance) {
                    nearest = bin;
                    nearestDistance = distance;
                }
            }
            if (nearest != null && nearestDistance < settings.getMergeThreshold()) {
                nearest.hexes.add(hex);
                binByHex.put(hex, nearest);
            } else {
                Bin bin = new Bin(hex, rgb);
                bins.add(bin);
                binByHex.put(hex, bin);
            }
        }

        for (ColorObservation observation : valid) {
            binByHex.get(observation.hex()).instances.add(observation);
        }

        List<ColorCluster> clusters = new ArrayList<>();
        for (Bin bin : bins) {
            clusters.add(new ColorCluster(bin.seedHex, bin.instances, new TreeSet<>(bin.hexes)).rekey());
        }
        clusters.sort(
            Comparator.comparingInt(ColorCluster::count).reversed()
                .thenComparing(ColorCluster::canonicalHex)
        );

        Map<String, ColorCluster> table = new LinkedHashMap<>();
        for (ColorCluster cluster : clusters) {
            table.put(cluster.canonicalHex(), cluster);
        }
        return new ColorTable(table, valid.size(), malformed);
    }

    /**
     * Categorized view of a consolidated table. Everything is recomputed from the final
     * canonical keys. Families are display-only and never change cluster counts.
     */
    public ColorSummary deriveSummary(ColorTable table) {
        ColorTable source = table == null ? ColorTable.empty() : table;
        Map<ColorUsage, List<String>> byUsage = new EnumMap<>(ColorUsage.class);
        Map<ColorUsage, Integer> usageCounts = new EnumMap<>(ColorUsage.class);
        for (ColorUsage usage : ColorUsage.values()) {
            byUsage.put(usage, new ArrayList<>());
            usageCounts.put(usage, 0);
        }
        List<String> neutrals = new ArrayList<>();
        List<String> outliers = new ArrayList<>();

        for (ColorCluster cluster : source.clusters().values()) {
            Set<ColorUsage> seen = new LinkedHashSet<>();
            for (ColorObservation observation : cluster.instances()) {
                if (observation.usedAs() == null) {
                    continue;
                }
                usageCounts.merge(observation.usedAs(), 1, Integer::sum);
                seen.add(observation.usedAs());
            }
            for (ColorUsage usage : seen) {
                byUsage.get(usage).add(cluster.canonicalHex());
            }
            Rgb rgb = ColorValues.parse(cluster.canonicalHex()).orElseThrow();
            if (ColorMath.isNeutral(rgb, settings.getNeutralTolerance())) {
                neutrals.add(cluster.canonicalHex());
            }
            if (cluster.count() <= settings.getOutlierMaxCount()) {
                outliers.add(cluster.canonicalHex());
            }
        }

        Map<ColorUsage, List<String>> frozen = new EnumMap<>(ColorUsage.class);
        byUsage.forEach((usage, hexes) -> frozen.put(usage, List.copyOf(hexes)));
        return new ColorSummary(
            source.uniqueColorCount(),
            frozen,
            usageCounts,
            List.copyOf(neutrals),
            List.copyOf(outliers),
            groupFamilies(source),
            source.observationCount(),
            source.malformedCount()
        );
    }

    List<ColorFamily> groupFamilies(ColorTable table) {
        List<ColorCluster> clusters = new ArrayList<>(table.clusters().values());
        Set<String> processed = new LinkedHashSet<>();
        List<ColorFamily> families = new ArrayList<>();
        for (ColorCluster main : clusters) {
            if (processed.contains(main.canonicalHex())) {
                continue;
            }
            processed.add(main.canonicalHex());
            Rgb mainRgb = ColorValues.parse(main.canonicalHex()).orElseThrow();
            List<String> variations = new ArrayList<>();
            variations.add(main.canonicalHex());
            int total = main.count();
            for (ColorCluster other : clusters) {
                if (processed.contains(other.canonicalHex())) {
                    continue;
                }
                Rgb otherRgb = ColorValues.parse(other.canonicalHex()).orElseThrow();
                if (ColorMath.euclideanDistance(mainRgb, otherRgb) < settings.getFamilyThreshold()) {
                    variations.add(other.canonicalHex());
                    total += other.count();
                    processed.add(other.canonicalHex());
                }
            }
            if (variations.size() > 1) {
                families.add(new ColorFamily(main.canonicalHex(), variations, total));
            }
        }
        return List.copyOf(families);
    }

    private static final class Bin {
        private final String seedHex;
        private final Rgb seed;
        private final Set<String> hexes = new LinkedHashSet<>();
        private final List<ColorObservation> instances = new ArrayList<>();

        private Bin(String seedHex, Rgb seed) {
            this.seedHex = seedHex;
            this.seed = seed;
            this.hexes.add(seedHex);
        }
    }
}
