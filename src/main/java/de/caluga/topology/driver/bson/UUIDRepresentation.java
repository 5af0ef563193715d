package de.caluga.topology.driver.bson;

/**
 * how a {@link java.util.UUID} is stored as binary. STANDARD uses subtype 4 and network byte order, the
 * legacy variants use subtype 3 with the byte order of the respective old driver.
 */
public enum UUIDRepresentation {

    UNSPECIFIED(-1), STANDARD(4), C_SHARP_LEGACY(3), JAVA_LEGACY(3), PYTHON_LEGACY(3);

    final int subtype;

    UUIDRepresentation(int s) {
        subtype = s;
    }

    public int getSubtype() {
        return subtype;
    }
}
