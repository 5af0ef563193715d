package de.caluga.topology.driver.bson;

import java.util.UUID;

/**
 * byte order conversion between {@link UUID} and the binary subtypes 3 and 4
 */
public final class UuidHelper {

    private UuidHelper() {
    }

    public static byte[] encode(UUID u, UUIDRepresentation rep) {
        byte[] b = new byte[16];
        writeLongBigEndian(b, 0, u.getMostSignificantBits());
        writeLongBigEndian(b, 8, u.getLeastSignificantBits());

        switch (rep) {
            case STANDARD:
            case PYTHON_LEGACY:
                break;

            case JAVA_LEGACY:
                reverse(b, 0, 8);
                reverse(b, 8, 8);
                break;

            case C_SHARP_LEGACY:
                reverse(b, 0, 4);
                reverse(b, 4, 2);
                reverse(b, 6, 2);
                break;

            default:
                throw new IllegalArgumentException("Cannot encode using " + rep.name() + " representation");
        }

        return b;
    }

    /**
     * @return the uuid, or null if the data cannot be decoded as uuid with the given representation
     */
    public static UUID decode(byte[] data, int subtype, UUIDRepresentation rep) {
        if (data.length != 16) {
            return null;
        }

        byte[] b = data.clone();

        if (subtype == MongoBinary.SUBTYPE_UUID) {
            //standard is always network byte order
        } else if (subtype == MongoBinary.SUBTYPE_UUID_LEGACY) {
            switch (rep) {
                case PYTHON_LEGACY:
                    break;

                case JAVA_LEGACY:
                    reverse(b, 0, 8);
                    reverse(b, 8, 8);
                    break;

                case C_SHARP_LEGACY:
                    reverse(b, 0, 4);
                    reverse(b, 4, 2);
                    reverse(b, 6, 2);
                    break;

                default:
                    return null;
            }
        } else {
            return null;
        }

        return new UUID(readLongBigEndian(b, 0), readLongBigEndian(b, 8));
    }

    private static void reverse(byte[] b, int off, int len) {
        for (int i = 0; i < len / 2; i++) {
            byte t = b[off + i];
            b[off + i] = b[off + len - 1 - i];
            b[off + len - 1 - i] = t;
        }
    }

    private static void writeLongBigEndian(byte[] b, int off, long v) {
        for (int i = 0; i < 8; i++) {
            b[off + i] = (byte) (v >>> ((7 - i) * 8));
        }
    }

    private static long readLongBigEndian(byte[] b, int off) {
        long v = 0;

        for (int i = 0; i < 8; i++) {
            v = (v << 8) | (b[off + i] & 0xFF);
        }

        return v;
    }
}
