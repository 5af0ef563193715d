package de.caluga.topology.driver.bson;

import java.util.Arrays;
import java.util.Date;

/**
 * 12 byte object id: 4 byte seconds since epoch (big endian), 5 byte process unique value, 3 byte
 * counter. New ids are created by a {@link MongoIdGenerator}.
 **/
public class MongoId implements Comparable<MongoId> {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] bytes;

    public MongoId() {
        this(MongoIdGenerator.getDefault().nextBytes(System.currentTimeMillis()));
    }

    public MongoId(Date date) {
        this(MongoIdGenerator.getDefault().nextBytes(date.getTime()));
    }

    public MongoId(String hexString) {
        this(hexToByte(hexString));
    }

    public MongoId(byte[] bytes) {
        this(bytes, 0);
    }

    public MongoId(byte[] bytes, int idx) {
        if (bytes == null) {
            throw new IllegalArgumentException("no data");
        } else if (idx + 12 > bytes.length) {
            throw new IllegalArgumentException("not enough data, 12 bytes needed");
        }

        this.bytes = Arrays.copyOfRange(bytes, idx, idx + 12);
    }

    public static boolean isValid(String hex) {
        if (hex == null || hex.length() != 24) {
            return false;
        }

        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) {
                return false;
            }
        }

        return true;
    }

    private static byte[] hexToByte(String s) {
        if (!isValid(s)) {
            throw new IllegalArgumentException("no hex string: " + s);
        }

        byte[] b = new byte[12];

        for (int i = 0; i < b.length; ++i) {
            b[i] = (byte) Integer.parseInt(s.substring(i * 2, i * 2 + 2), 16);
        }

        return b;
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * @return seconds since epoch
     */
    public int getTimestamp() {
        return (bytes[0] & 0xFF) << 24 | (bytes[1] & 0xFF) << 16 | (bytes[2] & 0xFF) << 8 | (bytes[3] & 0xFF);
    }

    public Date getDate() {
        return new Date((getTimestamp() & 0xFFFFFFFFL) * 1000L);
    }

    public String toHexString() {
        char[] chars = new char[24];

        for (int i = 0; i < 12; i++) {
            chars[i * 2] = HEX[(bytes[i] >>> 4) & 0x0f];
            chars[i * 2 + 1] = HEX[bytes[i] & 0x0f];
        }

        return new String(chars);
    }

    @Override
    public String toString() {
        return toHexString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (o == null || o.getClass() != this.getClass()) {
            return false;
        }

        return Arrays.equals(bytes, ((MongoId) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public int compareTo(MongoId o) {
        if (o == null) {
            return -1;
        }

        return Arrays.compareUnsigned(bytes, o.bytes);
    }
}
