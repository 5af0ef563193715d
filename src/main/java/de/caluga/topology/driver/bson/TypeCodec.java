package de.caluga.topology.driver.bson;

import java.util.Map;

/**
 * user supplied mapping between an application type and a document representation. Registered in a
 * {@link TypeCodecRegistry}, consulted before the built in types.
 *
 * @param <T> the application type
 */
public interface TypeCodec<T> {

    Class<T> getEncoderClass();

    Map<String, Object> encode(T value);

    /**
     * @return true, if the given (already decoded) document was produced by {@link #encode(Object)}
     */
    boolean canDecode(Map<String, Object> doc);

    T decode(Map<String, Object> doc);
}
