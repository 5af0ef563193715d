package de.caluga.topology.driver.bson;

/**
 * Extended JSON output flavour
 */
public enum JsonMode {
    /**
     * the format older tools (mongoexport before 3.x) understand
     */
    LEGACY,
    /**
     * readable, loses some type information (int vs. long, ...)
     */
    RELAXED,
    /**
     * fully type preserving
     */
    CANONICAL
}
