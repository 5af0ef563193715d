package de.caluga.topology.driver.bson;

import de.caluga.topology.driver.ConfigurationException;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * ordered list of {@link TypeCodec}s. The first matching codec wins, on encode and on decode.
 */
public class TypeCodecRegistry {
    public static final TypeCodecRegistry EMPTY = new TypeCodecRegistry(Collections.emptyList());

    private static final List<Class<?>> RESERVED = List.of(String.class, Number.class, Boolean.class, Character.class, Date.class,
                    byte[].class, Map.class, Collection.class, UUID.class, Pattern.class, MongoId.class, ObjectId.class, Decimal128.class,
                    MongoTimestamp.class, MongoBinary.class, MongoRegex.class, MongoJSScript.class, MongoMinKey.class, MongoMaxKey.class,
                    DBRef.class);

    private final List<TypeCodec<?>> codecs = new CopyOnWriteArrayList<>();

    public TypeCodecRegistry() {
    }

    public TypeCodecRegistry(List<TypeCodec<?>> codecs) {
        for (TypeCodec<?> c : codecs) {
            validate(c);
        }

        this.codecs.addAll(codecs);
    }

    public TypeCodecRegistry register(TypeCodec<?> codec) {
        if (this == EMPTY) {
            throw new UnsupportedOperationException("cannot register on the empty registry");
        }

        validate(codec);
        codecs.add(codec);
        return this;
    }

    private static void validate(TypeCodec<?> codec) {
        Class<?> cls = codec.getEncoderClass();

        if (cls == null) {
            throw new ConfigurationException("codec " + codec.getClass().getName() + " has no encoder class");
        }

        for (Class<?> r : RESERVED) {
            if (r.isAssignableFrom(cls) || cls.isAssignableFrom(r)) {
                throw new ConfigurationException("codec " + codec.getClass().getName() + " cannot override built-in type " + r.getName());
            }
        }

        if (cls.isPrimitive() || cls.isArray() || cls.isEnum()) {
            throw new ConfigurationException("codec " + codec.getClass().getName() + " cannot override built-in type " + cls.getName());
        }
    }

    @SuppressWarnings("unchecked")
    public <T> TypeCodec<T> findEncoder(Class<T> cls) {
        for (TypeCodec<?> c : codecs) {
            if (c.getEncoderClass().isAssignableFrom(cls)) {
                return (TypeCodec<T>) c;
            }
        }

        return null;
    }

    /**
     * @return encoded document, or null if no codec handles the value
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> encode(Object value) {
        TypeCodec<Object> c = (TypeCodec<Object>) findEncoder(value.getClass());
        return c == null ? null : c.encode(value);
    }

    /**
     * @return decoded value, or the document itself if no codec matches
     */
    public Object decode(Map<String, Object> doc) {
        for (TypeCodec<?> c : codecs) {
            if (c.canDecode(doc)) {
                return c.decode(doc);
            }
        }

        return doc;
    }

    public boolean isEmpty() {
        return codecs.isEmpty();
    }

    public List<TypeCodec<?>> getCodecs() {
        return new ArrayList<>(codecs);
    }
}
