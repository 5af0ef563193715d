package de.caluga.topology.driver.bson;

import java.util.Arrays;

/**
 * binary data with subtype. Subtype 0 data is usually handled as plain <code>byte[]</code>, this class
 * keeps the subtype for everything else.
 **/
public class MongoBinary {
    public static final int SUBTYPE_GENERIC = 0x00;
    public static final int SUBTYPE_FUNCTION = 0x01;
    public static final int SUBTYPE_OLD_BINARY = 0x02;
    public static final int SUBTYPE_UUID_LEGACY = 0x03;
    public static final int SUBTYPE_UUID = 0x04;
    public static final int SUBTYPE_MD5 = 0x05;
    public static final int SUBTYPE_USER_DEFINED = 0x80;

    private final byte[] data;
    private final int subtype;

    public MongoBinary(byte[] data) {
        this(data, SUBTYPE_GENERIC);
    }

    public MongoBinary(byte[] data, int subtype) {
        if (subtype < 0 || subtype > 255) {
            throw new IllegalArgumentException("subtype must be 0..255, was " + subtype);
        }

        this.data = data == null ? new byte[0] : data.clone();
        this.subtype = subtype;
    }

    public byte[] getData() {
        return data.clone();
    }

    public int getSubtype() {
        return subtype;
    }

    public int length() {
        return data.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MongoBinary that = (MongoBinary) o;
        return subtype == that.subtype && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * subtype + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Binary{subtype=" + subtype + ", length=" + data.length + '}';
    }
}
