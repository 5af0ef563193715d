package de.caluga.topology.driver;

import de.caluga.topology.sdam.MaxStalenessSelector;
import de.caluga.topology.sdam.Selection;
import de.caluga.topology.sdam.ServerSelector;
import de.caluga.topology.sdam.ServerSelectors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read preference defines which node will be used for processing a read.
 * Tag sets are tried in order, the first one matching any eligible member wins. An empty tag set matches
 * every member.
 **/
public final class ReadPreference implements ServerSelector {
    private static final List<Map<String, String>> MATCH_ALL = List.of(Map.of());
    private static final ReadPreference PRIMARY = new ReadPreference(ReadPreferenceType.PRIMARY, null, -1);

    private final ReadPreferenceType type;
    private final List<Map<String, String>> tagSets;
    private final int maxStalenessSeconds;

    private ReadPreference(ReadPreferenceType type, List<Map<String, String>> tagSets, int maxStalenessSeconds) {
        this.type = type;

        if (tagSets == null || tagSets.isEmpty()) {
            this.tagSets = MATCH_ALL;
        } else {
            List<Map<String, String>> l = new ArrayList<>();

            for (Map<String, String> t : tagSets) {
                if (t == null) {
                    throw new ConfigurationException("tag set must not be null");
                }

                l.add(Collections.unmodifiableMap(new LinkedHashMap<>(t)));
            }

            this.tagSets = Collections.unmodifiableList(l);
        }

        if (maxStalenessSeconds != -1 && maxStalenessSeconds <= 0) {
            throw new ConfigurationException("maxStalenessSeconds must be a positive integer, not " + maxStalenessSeconds);
        }

        this.maxStalenessSeconds = maxStalenessSeconds;
    }

    public static ReadPreference of(ReadPreferenceType type, List<Map<String, String>> tagSets, int maxStalenessSeconds) {
        if (type == ReadPreferenceType.PRIMARY) {
            if (tagSets != null && !tagSets.isEmpty() && !tagSets.equals(MATCH_ALL)) {
                throw new ConfigurationException("Read preference primary cannot be combined with tags");
            }

            if (maxStalenessSeconds != -1) {
                throw new ConfigurationException("Read preference primary cannot be combined with maxStalenessSeconds");
            }

            return PRIMARY;
        }

        return new ReadPreference(type, tagSets, maxStalenessSeconds);
    }

    public static ReadPreference fromName(String mode) {
        return of(ReadPreferenceType.fromName(mode), null, -1);
    }

    public static ReadPreference primary() {
        return PRIMARY;
    }

    public static ReadPreference primaryPreferred() {
        return primaryPreferred(null, -1);
    }

    public static ReadPreference primaryPreferred(List<Map<String, String>> tagSets, int maxStalenessSeconds) {
        return of(ReadPreferenceType.PRIMARY_PREFERRED, tagSets, maxStalenessSeconds);
    }

    public static ReadPreference secondary() {
        return secondary(null, -1);
    }

    public static ReadPreference secondary(List<Map<String, String>> tagSets, int maxStalenessSeconds) {
        return of(ReadPreferenceType.SECONDARY, tagSets, maxStalenessSeconds);
    }

    public static ReadPreference secondaryPreferred() {
        return secondaryPreferred(null, -1);
    }

    public static ReadPreference secondaryPreferred(List<Map<String, String>> tagSets, int maxStalenessSeconds) {
        return of(ReadPreferenceType.SECONDARY_PREFERRED, tagSets, maxStalenessSeconds);
    }

    public static ReadPreference nearest() {
        return nearest(null, -1);
    }

    public static ReadPreference nearest(List<Map<String, String>> tagSets, int maxStalenessSeconds) {
        return of(ReadPreferenceType.NEAREST, tagSets, maxStalenessSeconds);
    }

    public ReadPreferenceType getType() {
        return type;
    }

    public List<Map<String, String>> getTagSets() {
        return tagSets;
    }

    public int getMaxStalenessSeconds() {
        return maxStalenessSeconds;
    }

    public boolean isPrimary() {
        return type == ReadPreferenceType.PRIMARY;
    }

    @Override
    public int getMinWireVersion() {
        return maxStalenessSeconds == -1 ? 0 : 5;
    }

    /**
     * the <code>$readPreference</code> document sent to a mongos
     */
    public Map<String, Object> document() {
        Doc d = Doc.of("mode", type.getMongoName());

        if (!tagSets.equals(MATCH_ALL)) {
            d.put("tags", new ArrayList<>(tagSets));
        }

        if (maxStalenessSeconds != -1) {
            d.put("maxStalenessSeconds", maxStalenessSeconds);
        }

        return d;
    }

    @Override
    public Selection select(Selection selection) {
        switch (type) {
            case PRIMARY:
                return selection.primarySelection();

            case PRIMARY_PREFERRED:
                if (selection.getPrimary() != null) {
                    return selection.primarySelection();
                }

                return ServerSelectors.secondaryWithTags(tagSets, MaxStalenessSelector.select(maxStalenessSeconds, selection));

            case SECONDARY:
                return ServerSelectors.secondaryWithTags(tagSets, MaxStalenessSelector.select(maxStalenessSeconds, selection));

            case SECONDARY_PREFERRED:
                Selection secondaries = ServerSelectors.secondaryWithTags(tagSets, MaxStalenessSelector.select(maxStalenessSeconds, selection));

                if (!secondaries.isEmpty()) {
                    return secondaries;
                }

                return selection.primarySelection();

            case NEAREST:
                return ServerSelectors.memberWithTags(tagSets, MaxStalenessSelector.select(maxStalenessSeconds, selection));

            default:
                throw new IllegalStateException("unknown read preference " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof ReadPreference)) {
            return false;
        }

        ReadPreference that = (ReadPreference) o;
        return maxStalenessSeconds == that.maxStalenessSeconds && type == that.type && tagSets.equals(that.tagSets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, tagSets, maxStalenessSeconds);
    }

    @Override
    public String toString() {
        if (type == ReadPreferenceType.PRIMARY) {
            return "Primary()";
        }

        return type.getDisplayName() + "(tag_sets=" + tagSets + ", max_staleness=" + maxStalenessSeconds + ")";
    }
}
