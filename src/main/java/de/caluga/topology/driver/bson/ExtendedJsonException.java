package de.caluga.topology.driver.bson;

/**
 * malformed Extended JSON wrapper or a value that cannot be written as JSON
 */
public class ExtendedJsonException extends IllegalArgumentException {

    public ExtendedJsonException(String message) {
        super(message);
    }

    public ExtendedJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
