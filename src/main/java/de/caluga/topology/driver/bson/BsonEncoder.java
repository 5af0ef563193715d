package de.caluga.topology.driver.bson;

import de.caluga.topology.driver.Doc;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.io.ByteArrayOutputStream;
import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.util.Calendar;
import java.util.Collection;
import java.util.Date;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * encoding BSON for sending data to mongodb
 */
@SuppressWarnings("WeakerAccess")
public class BsonEncoder {
    private final ByteArrayOutputStream out;
    private UUIDRepresentation uuidRepresentation = UUIDRepresentation.STANDARD;
    private TypeCodecRegistry registry = TypeCodecRegistry.EMPTY;

    public BsonEncoder() {
        out = new ByteArrayOutputStream();
    }

    public static byte[] encodeDocument(Map<String, Object> m) {
        return encodeDocument(m, UUIDRepresentation.STANDARD, TypeCodecRegistry.EMPTY);
    }

    public static byte[] encodeDocument(Map<String, Object> m, UUIDRepresentation representation) {
        return encodeDocument(m, representation, TypeCodecRegistry.EMPTY);
    }

    public static byte[] encodeDocument(Map<String, Object> m, UUIDRepresentation representation, TypeCodecRegistry registry) {
        BsonEncoder enc = new BsonEncoder();
        enc.setUuidRepresentation(representation);
        enc.setRegistry(registry == null ? TypeCodecRegistry.EMPTY : registry);

        for (Map.Entry<String, Object> e : m.entrySet()) {
            enc.encodeObject(e.getKey(), e.getValue());
        }

        byte[] elements = enc.getBytes();
        BsonEncoder doc = new BsonEncoder();
        doc.writeInt(elements.length + 4 + 1);
        doc.writeBytes(elements);
        doc.writeByte(0);
        return doc.getBytes();
    }

    public UUIDRepresentation getUuidRepresentation() {
        return uuidRepresentation;
    }

    public BsonEncoder setUuidRepresentation(UUIDRepresentation uuidRepresentation) {
        this.uuidRepresentation = uuidRepresentation;
        return this;
    }

    public TypeCodecRegistry getRegistry() {
        return registry;
    }

    public BsonEncoder setRegistry(TypeCodecRegistry registry) {
        this.registry = registry;
        return this;
    }

    public byte[] getBytes() {
        return out.toByteArray();
    }

    private byte[] subDocument(Map<String, Object> m) {
        return encodeDocument(m, uuidRepresentation, registry);
    }

    @SuppressWarnings("UnusedReturnValue")
    private BsonEncoder string(String s) {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        writeInt(b.length + 1);
        writeBytes(b);
        writeByte(0);
        return this;
    }

    @SuppressWarnings("UnusedReturnValue")
    private BsonEncoder cString(String s) {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);

        for (byte c : b) {
            if (c == 0) {
                throw new IllegalArgumentException("key or pattern must not contain a 0 byte: " + s);
            }
        }

        writeBytes(b);
        writeByte(0);
        return this;
    }

    private void binary(String n, byte[] data, int subtype) {
        writeByte(5);
        cString(n);
        writeInt(data.length);
        writeByte(subtype);
        writeBytes(data);
    }

    @SuppressWarnings({"UnusedReturnValue", "unchecked"})
    public BsonEncoder encodeObject(String n, Object v) {
        if (v == null) {
            writeByte(10).cString(n);
        } else if (v instanceof Float) {
            writeByte(1).cString(n);
            writeLong(Double.doubleToLongBits(((Float) v).doubleValue()));
        } else if (v instanceof Double) {
            writeByte(1).cString(n);
            writeLong(Double.doubleToLongBits((Double) v));
        } else if (v instanceof String) {
            writeByte(2);
            cString(n);
            string((String) v);
        } else if (v instanceof Map) {
            writeByte(3);
            cString(n);
            writeBytes(subDocument((Map<String, Object>) v));
        } else if (v instanceof Collection) {
            writeByte(4);
            cString(n);
            Doc doc = Doc.of();
            int cnt = 0;

            for (Object o : (Collection<?>) v) {
                doc.put("" + (cnt++), o);
            }

            writeBytes(subDocument(doc));
        } else if (v instanceof byte[]) {
            binary(n, (byte[]) v, MongoBinary.SUBTYPE_GENERIC);
        } else if (v.getClass().isArray()) {
            writeByte(4);
            cString(n);
            Doc doc = Doc.of();
            int arrayLength = Array.getLength(v);

            for (int i = 0; i < arrayLength; i++) {
                doc.put("" + i, Array.get(v, i));
            }

            writeBytes(subDocument(doc));
        } else if (v instanceof UUID) {
            if (uuidRepresentation == UUIDRepresentation.UNSPECIFIED) {
                throw new IllegalArgumentException("Cannot encode using UNSPECIFIED representation");
            }

            binary(n, UuidHelper.encode((UUID) v, uuidRepresentation), uuidRepresentation.subtype);
        } else if (v instanceof MongoBinary) {
            MongoBinary b = (MongoBinary) v;
            binary(n, b.getData(), b.getSubtype());
        } else if (v instanceof MongoId) {
            writeByte(7);
            cString(n);
            writeBytes(((MongoId) v).getBytes());
        } else if (v instanceof ObjectId) {
            writeByte(7);
            cString(n);
            writeBytes(((ObjectId) v).toByteArray());
        } else if (v instanceof Boolean) {
            writeByte(8);
            cString(n);
            writeByte((Boolean) v ? 1 : 0);
        } else if (v instanceof Date) {
            writeByte(9);
            cString(n);
            writeLong(((Date) v).getTime());
        } else if (v instanceof Calendar) {
            writeByte(9);
            cString(n);
            writeLong(((Calendar) v).getTimeInMillis());
        } else if (v instanceof MongoRegex) {
            writeByte(0x0b);
            cString(n);
            cString(((MongoRegex) v).getPattern());
            cString(((MongoRegex) v).getFlags());
        } else if (v instanceof Pattern) {
            Pattern p = (Pattern) v;
            writeByte(0x0b);
            cString(n);
            cString(p.pattern());
            cString(MongoRegex.flagsOf(p.flags()));
        } else if (v instanceof DBRef) {
            writeByte(3);
            cString(n);
            writeBytes(subDocument(((DBRef) v).asDoc()));
        } else if (v instanceof MongoJSScript) {
            //with scope 0x0f, otherwise 0x0d
            MongoJSScript s = (MongoJSScript) v;

            if (s.getScope() != null) {
                writeByte(0x0f);
                cString(n);
                BsonEncoder code = new BsonEncoder();
                code.string(s.getJs());
                byte[] codeBytes = code.getBytes();
                byte[] scope = subDocument(s.getScope());
                writeInt(4 + codeBytes.length + scope.length);
                writeBytes(codeBytes);
                writeBytes(scope);
            } else {
                writeByte(0x0d);
                cString(n);
                string(s.getJs());
            }
        } else if (v instanceof Byte || v instanceof Short || v instanceof Integer) {
            writeByte(0x10);
            cString(n);
            writeInt(((Number) v).intValue());
        } else if (v instanceof Character) {
            writeByte(0x10);
            cString(n);
            writeInt((Character) v);
        } else if (v instanceof MongoTimestamp) {
            writeByte(0x11);
            cString(n);
            writeLong(((MongoTimestamp) v).getValue());
        } else if (v instanceof Long) {
            writeByte(0x12);
            cString(n);
            writeLong((Long) v);
        } else if (v instanceof Decimal128) {
            writeByte(0x13);
            cString(n);
            writeLong(((Decimal128) v).getLow());
            writeLong(((Decimal128) v).getHigh());
        } else if (v instanceof MongoMinKey) {
            writeByte(0xff);
            cString(n);
        } else if (v instanceof MongoMaxKey) {
            writeByte(0x7f);
            cString(n);
        } else if (v.getClass().isEnum()) {
            writeByte(2);
            cString(n);
            string(v.toString());
        } else {
            Map<String, Object> encoded = registry.encode(v);

            if (encoded == null) {
                throw new IllegalArgumentException("Unhandled Data type: " + v.getClass().getName());
            }

            writeByte(3);
            cString(n);
            writeBytes(subDocument(encoded));
        }

        return this;
    }

    private void writeBytes(byte[] data) {
        out.write(data, 0, data.length);
    }

    private void writeInt(int val) {
        for (int i = 0; i < 4; i++) {
            out.write((byte) ((val >> (i * 8)) & 0xff));
        }
    }

    private void writeLong(long lng) {
        for (int i = 0; i < 8; i++) {
            out.write((byte) ((lng >> (i * 8)) & 0xff));
        }
    }

    private BsonEncoder writeByte(int v) {
        out.write((byte) v);
        return this;
    }
}
