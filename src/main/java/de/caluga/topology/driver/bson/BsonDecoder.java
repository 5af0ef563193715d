package de.caluga.topology.driver.bson;

import de.caluga.topology.driver.Doc;
import org.bson.types.Decimal128;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * decoding BSON coming from mongodb
 **/
@SuppressWarnings("WeakerAccess")
public class BsonDecoder {
    private final UUIDRepresentation uuidRepresentation;
    private final TypeCodecRegistry registry;

    public BsonDecoder() {
        this(UUIDRepresentation.STANDARD, TypeCodecRegistry.EMPTY);
    }

    public BsonDecoder(UUIDRepresentation uuidRepresentation, TypeCodecRegistry registry) {
        this.uuidRepresentation = uuidRepresentation;
        this.registry = registry == null ? TypeCodecRegistry.EMPTY : registry;
    }

    public static Map<String, Object> decodeDocument(byte[] in) {
        Doc ret = Doc.of();
        decodeDocumentIn(ret, in, 0);
        return ret;
    }

    public static Map<String, Object> decodeDocument(byte[] in, TypeCodecRegistry registry) {
        Doc ret = Doc.of();
        new BsonDecoder(UUIDRepresentation.STANDARD, registry).decodeIn(ret, in, 0);
        return ret;
    }

    /**
     * @return number of bytes consumed
     */
    public static int decodeDocumentIn(Map<String, Object> ret, byte[] in, int startIndex) {
        return new BsonDecoder().decodeIn(ret, in, startIndex);
    }

    public int decodeIn(Map<String, Object> ret, byte[] in, int startIndex) {
        return decodeIn(ret, in, startIndex, in.length);
    }

    /**
     * @param limit index the document must end before, the end of the enclosing element for nested documents
     */
    private int decodeIn(Map<String, Object> ret, byte[] in, int startIndex, int limit) {
        if (startIndex < 0 || startIndex + 5 > limit) {
            throw new IllegalArgumentException("not enough data for a document at " + startIndex);
        }

        int sz = readInt(in, startIndex);

        if (sz < 5 || sz > limit - startIndex) {
            throw new IllegalArgumentException("error - size differs! read " + sz + " but only " + (limit - startIndex) + " bytes available");
        }

        int end = startIndex + sz - 1;

        if (in[end] != 0) {
            throw new IllegalArgumentException("document not terminated by 0");
        }

        int idx = startIndex + 4;

        while (idx < end) {
            byte type = in[idx++];
            int l = cStrLen(in, idx, end);
            String name = new String(in, idx, l, StandardCharsets.UTF_8);
            idx += l + 1;
            Object value;

            switch (type) {
                case 0x01:
                    //double
                    need(idx, 8, end, name);
                    value = Double.longBitsToDouble(readLong(in, idx));
                    idx += 8;
                    break;

                case 0x02:
                case 0x0e:
                    //string, symbol (deprecated) is read as string
                    need(idx, 4, end, name);
                    int strlen = readInt(in, idx);
                    checkStrLength(in, idx + 4, strlen, end);
                    value = new String(in, idx + 4, strlen - 1, StandardCharsets.UTF_8);
                    idx += strlen + 4;
                    break;

                case 0x03:
                    //document
                    Doc doc = Doc.of();
                    int len = decodeIn(doc, in, idx, end);
                    value = postProcess(doc);
                    idx += len;
                    break;

                case 0x04:
                    //array
                    doc = Doc.of();
                    len = decodeIn(doc, in, idx, end);
                    value = new ArrayList<>(doc.values());
                    idx += len;
                    break;

                case 0x05:
                    need(idx, 5, end, name);
                    int boblen = readInt(in, idx);
                    checkLength(in, idx + 5, boblen, end);
                    int subtype = in[idx + 4] & 0xFF;
                    byte[] bobdata = new byte[boblen];
                    System.arraycopy(in, idx + 5, bobdata, 0, boblen);

                    if (subtype == MongoBinary.SUBTYPE_UUID || subtype == MongoBinary.SUBTYPE_UUID_LEGACY) {
                        UUID u = UuidHelper.decode(bobdata, subtype, uuidRepresentation);
                        value = u != null ? u : new MongoBinary(bobdata, subtype);
                    } else if (subtype == MongoBinary.SUBTYPE_GENERIC) {
                        value = bobdata;
                    } else {
                        value = new MongoBinary(bobdata, subtype);
                    }

                    idx += boblen + 5;
                    break;

                case 0x06:
                    //undefined, deprecated
                    value = null;
                    break;

                case 0x07:
                    need(idx, 12, end, name);
                    value = new MongoId(in, idx);
                    idx += 12;
                    break;

                case 0x08:
                    need(idx, 1, end, name);
                    value = in[idx] == 0x01;
                    idx++;
                    break;

                case 0x09:
                    need(idx, 8, end, name);
                    value = new Date(readLong(in, idx));
                    idx += 8;
                    break;

                case 0x0a:
                    value = null;
                    break;

                case 0x0b:
                    l = cStrLen(in, idx, end);
                    String pattern = new String(in, idx, l, StandardCharsets.UTF_8);
                    idx += l + 1;
                    l = cStrLen(in, idx, end);
                    String opts = new String(in, idx, l, StandardCharsets.UTF_8);
                    idx += l + 1;
                    value = new MongoRegex(pattern, opts);
                    break;

                case 0x0c:
                    //db pointer, deprecated - string namespace + id
                    need(idx, 4, end, name);
                    strlen = readInt(in, idx);
                    checkStrLength(in, idx + 4, strlen, end);
                    String ns = new String(in, idx + 4, strlen - 1, StandardCharsets.UTF_8);
                    idx += strlen + 4;
                    need(idx, 12, end, name);
                    value = new DBRef(ns, new MongoId(in, idx));
                    idx += 12;
                    break;

                case 0x0d:
                    //javascript
                    need(idx, 4, end, name);
                    strlen = readInt(in, idx);
                    checkStrLength(in, idx + 4, strlen, end);
                    value = new MongoJSScript(new String(in, idx + 4, strlen - 1, StandardCharsets.UTF_8));
                    idx += strlen + 4;
                    break;

                case 0x0f:
                    //javascript w/ scope - first 4 bytes the whole length
                    need(idx, 8, end, name);
                    int total = readInt(in, idx);
                    strlen = readInt(in, idx + 4);
                    checkStrLength(in, idx + 8, strlen, end);

                    if (total < 8 + strlen + 5 || total > end - idx) {
                        throw new IllegalArgumentException("invalid code with scope length " + total + " for field " + name);
                    }

                    String code = new String(in, idx + 8, strlen - 1, StandardCharsets.UTF_8);
                    Doc scope = Doc.of();

                    if (decodeIn(scope, in, idx + 8 + strlen, idx + total) != total - 8 - strlen) {
                        throw new IllegalArgumentException("scope size does not match code with scope length for field " + name);
                    }

                    value = new MongoJSScript(code, scope);
                    idx += total;
                    break;

                case 0x10:
                    need(idx, 4, end, name);
                    value = readInt(in, idx);
                    idx += 4;
                    break;

                case 0x11:
                    need(idx, 8, end, name);
                    value = new MongoTimestamp(readLong(in, idx));
                    idx += 8;
                    break;

                case 0x12:
                    need(idx, 8, end, name);
                    value = readLong(in, idx);
                    idx += 8;
                    break;

                case 0x13:
                    need(idx, 16, end, name);
                    long low = readLong(in, idx);
                    long high = readLong(in, idx + 8);
                    value = Decimal128.fromIEEE754BIDEncoding(high, low);
                    idx += 16;
                    break;

                case (byte) 0xff:
                    value = MongoMinKey.INSTANCE;
                    break;

                case 0x7f:
                    value = MongoMaxKey.INSTANCE;
                    break;

                default:
                    throw new IllegalArgumentException("unknown data type: " + type + " for field " + name);
            }

            if (idx > end) {
                throw new IllegalArgumentException("field " + name + " exceeds document boundary");
            }

            ret.put(name, value);
        }

        return sz;
    }

    private Object postProcess(Doc doc) {
        Object ref = doc.get("$ref");

        if (ref instanceof String && doc.containsKey("$id") && (doc.get("$db") == null || doc.get("$db") instanceof String)) {
            boolean onlyRefKeys = true;

            for (String k : doc.keySet()) {
                if (k.startsWith("$") && !k.equals("$ref") && !k.equals("$id") && !k.equals("$db")) {
                    onlyRefKeys = false;
                    break;
                }
            }

            if (onlyRefKeys) {
                Doc extra = new Doc(doc);
                extra.remove("$ref");
                extra.remove("$id");
                extra.remove("$db");
                return new DBRef((String) ref, doc.get("$id"), (String) doc.get("$db"), extra);
            }
        }

        if (!registry.isEmpty()) {
            return registry.decode(doc);
        }

        return doc;
    }

    private static void checkStrLength(byte[] in, int idx, int len, int end) {
        checkLength(in, idx, len, end);

        if (len < 1 || in[idx + len - 1] != 0) {
            throw new IllegalArgumentException("invalid string at " + idx);
        }
    }

    private static int cStrLen(byte[] in, int idx, int end) {
        if (idx >= end) {
            throw new IllegalArgumentException("unterminated string at " + idx);
        }

        int l = 0;

        while (in[idx + l] != 0) {
            l++;

            if (idx + l >= end) {
                throw new IllegalArgumentException("unterminated string at " + idx);
            }
        }

        return l;
    }

    private static void need(int idx, int width, int end, String name) {
        if (idx + width > end) {
            throw new IllegalArgumentException("field " + name + " exceeds document boundary");
        }
    }

    private static void checkLength(byte[] in, int idx, int len, int end) {
        if (len < 0 || len > end - idx) {
            throw new IllegalArgumentException("invalid length " + len + " at " + idx);
        }
    }

    public static int readInt(byte[] bytes, int idx) {
        return (bytes[idx] & 0xFF) | (bytes[idx + 1] & 0xFF) << 8 | (bytes[idx + 2] & 0xFF) << 16 | ((bytes[idx + 3] & 0xFF) << 24);
    }

    public static long readLong(byte[] bytes, int idx) {
        return ((long) ((bytes[idx] & 0xFF))) | ((long) ((bytes[idx + 1] & 0xFF)) << 8) | ((long) (bytes[idx + 2] & 0xFF) << 16) | ((long) (bytes[idx + 3] & 0xFF) << 24)
            | ((long) (bytes[idx + 4] & 0xFF) << 32) | ((long) (bytes[idx + 5] & 0xFF) << 40) | ((long) (bytes[idx + 6] & 0xFF) << 48) | ((long) (bytes[idx + 7] & 0xFF) << 56);
    }
}
