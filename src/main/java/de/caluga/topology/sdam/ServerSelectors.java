package de.caluga.topology.sdam;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

public final class ServerSelectors {
    public static final ServerSelector ANY = named("any", s -> s);
    public static final ServerSelector READABLE = filter("readable", ServerDescription::isReadable);
    public static final ServerSelector WRITABLE = filter("writable", ServerDescription::isWritable);
    public static final ServerSelector SECONDARY = filter("secondary", sd -> sd.getType() == ServerType.RSSecondary);
    public static final ServerSelector ARBITER = filter("arbiter", sd -> sd.getType() == ServerType.RSArbiter);

    private static final ServerSelector WRITABLE_PREFERRED = named("writablePreferred", s -> {
        Selection w = WRITABLE.select(s);
        return w.isEmpty() ? SECONDARY.select(s) : w;
    });

    private ServerSelectors() {
    }

    /**
     * writable servers if there are any, secondaries otherwise
     */
    public static ServerSelector writablePreferred() {
        return WRITABLE_PREFERRED;
    }

    public static Selection applySingleTagSet(Map<String, String> tagSet, Selection selection) {
        List<ServerDescription> ret = new ArrayList<>();

        for (ServerDescription sd : selection.getServerDescriptions()) {
            if (tagsMatch(tagSet, sd.getTags())) {
                ret.add(sd);
            }
        }

        return selection.withServerDescriptions(ret);
    }

    private static boolean tagsMatch(Map<String, String> tagSet, Map<String, String> serverTags) {
        for (Map.Entry<String, String> e : tagSet.entrySet()) {
            if (!e.getValue().equals(serverTags.get(e.getKey()))) {
                return false;
            }
        }

        return true;
    }

    /**
     * the servers matching the first tag set that matches any server at all
     */
    public static Selection applyTagSets(List<Map<String, String>> tagSets, Selection selection) {
        for (Map<String, String> tagSet : tagSets) {
            Selection filtered = applySingleTagSet(tagSet, selection);

            if (!filtered.isEmpty()) {
                return filtered;
            }
        }

        return selection.withServerDescriptions(List.of());
    }

    public static Selection secondaryWithTags(List<Map<String, String>> tagSets, Selection selection) {
        return applyTagSets(tagSets, SECONDARY.select(selection));
    }

    public static Selection memberWithTags(List<Map<String, String>> tagSets, Selection selection) {
        return applyTagSets(tagSets, READABLE.select(selection));
    }

    private static ServerSelector filter(String name, Predicate<ServerDescription> p) {
        return named(name, s -> {
            List<ServerDescription> ret = new ArrayList<>();

            for (ServerDescription sd : s.getServerDescriptions()) {
                if (p.test(sd)) {
                    ret.add(sd);
                }
            }

            return s.withServerDescriptions(ret);
        });
    }

    private static ServerSelector named(String name, ServerSelector delegate) {
        return new ServerSelector() {
            @Override
            public Selection select(Selection selection) {
                return delegate.select(selection);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
