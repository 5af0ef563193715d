package de.caluga.topology.config;

/**
 * looks up a single setting by its (prefixed) name, returns null if not set
 */
@FunctionalInterface
public interface ConfigResolver {
    Object resolveSetting(String name);
}
