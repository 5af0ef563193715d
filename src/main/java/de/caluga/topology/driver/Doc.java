package de.caluga.topology.driver;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ordered document as sent to and received from the server. Key order matters for commands: the
 * command name must always be the first key.
 */
public class Doc extends LinkedHashMap<String, Object> {

    public Doc() {
    }

    public Doc(Map<? extends String, ?> m) {
        super();
        if (m != null) {
            putAll(m);
        }
    }

    public static Doc of() {
        return new Doc();
    }

    public static Doc of(String k1, Object v1) {
        return of().add(k1, v1);
    }

    public static Doc of(String k1, Object v1, String k2, Object v2) {
        return of().add(k1, v1)
                .add(k2, v2);
    }

    public static Doc of(String k1, Object v1, String k2, Object v2, String k3, Object v3) {
        return of().add(k1, v1)
                .add(k2, v2)
                .add(k3, v3);
    }

    public static Doc of(String k1, Object v1, String k2, Object v2, String k3, Object v3, String k4, Object v4) {
        return of().add(k1, v1)
                .add(k2, v2)
                .add(k3, v3)
                .add(k4, v4);
    }

    public Doc add(String k, Object value) {
        put(k, value);
        return this;
    }

    public Doc addIfNotNull(String k, Object value) {
        if (value != null) put(k, value);
        return this;
    }
}
