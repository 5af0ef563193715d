package de.caluga.topology.sdam;

/**
 * Narrows a {@link Selection} down to the servers an operation may use.
 */
@FunctionalInterface
public interface ServerSelector {
    Selection select(Selection selection);

    /**
     * minimum wire version all servers need for this selector to work, 0 if there is no requirement
     */
    default int getMinWireVersion() {
        return 0;
    }
}
