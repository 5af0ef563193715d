package de.caluga.topology.config;

import de.caluga.topology.driver.ConfigurationException;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Consumer;

/**
 * Base of all settings groups. Copying, comparing, exporting and loading work on the declared non-static,
 * non-transient fields.
 */
public abstract class Settings {

    protected List<Field> getSettingFields() {
        List<Field> ret = new ArrayList<>();

        for (Class<?> c = getClass(); c != null && !c.equals(Settings.class); c = c.getSuperclass()) {
            for (Field f : c.getDeclaredFields()) {
                if (Modifier.isStatic(f.getModifiers()) || Modifier.isTransient(f.getModifiers()) || f.isSynthetic()) {
                    continue;
                }

                f.setAccessible(true);
                ret.add(f);
            }
        }

        return ret;
    }

    public Properties asProperties() {
        return asProperties(null);
    }

    /**
     * all settings differing from the defaults
     */
    public Properties asProperties(String prefix) {
        Properties p = new Properties();

        if (prefix == null || prefix.isEmpty()) {
            prefix = "";
        } else {
            prefix = prefix + ".";
        }

        try {
            Settings defaults = getClass().getConstructor().newInstance();

            for (Field f : getSettingFields()) {
                Object v = f.get(this);

                if (v != null && !v.equals(f.get(defaults))) {
                    if (v instanceof List) {
                        p.put(prefix + f.getName(), String.join(",", ((List<?>) v).stream().map(String::valueOf).toArray(String[]::new)));
                    } else {
                        p.put(prefix + f.getName(), v.toString());
                    }
                }
            }
        } catch (ReflectiveOperationException e) {
            throw new ConfigurationException("could not export settings of " + getClass().getSimpleName(), e);
        }

        return p;
    }

    /**
     * sets every field whose (prefixed) name the resolver knows, converting from the string representation
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public void loadFrom(String prefix, ConfigResolver resolver) {
        if (prefix == null || prefix.isEmpty()) {
            prefix = "";
        } else {
            prefix = prefix + ".";
        }

        for (Field f : getSettingFields()) {
            Object setting = resolver.resolveSetting(prefix + f.getName());

            if (setting == null) {
                continue;
            }

            String value = setting.toString().trim();
            Class<?> type = f.getType();

            try {
                if (type.equals(int.class) || type.equals(Integer.class)) {
                    f.set(this, Integer.parseInt(value));
                } else if (type.equals(long.class) || type.equals(Long.class)) {
                    f.set(this, Long.parseLong(value));
                } else if (type.equals(boolean.class) || type.equals(Boolean.class)) {
                    f.set(this, value.equalsIgnoreCase("true"));
                } else if (type.isEnum()) {
                    f.set(this, Enum.valueOf((Class<? extends Enum>) type, value));
                } else if (type.equals(String.class)) {
                    f.set(this, value);
                } else if (List.class.isAssignableFrom(type)) {
                    f.set(this, parseList(value));
                }
            } catch (IllegalAccessException e) {
                throw new ConfigurationException("could not set " + f.getName(), e);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("invalid value for " + prefix + f.getName() + ": " + value, e);
            }
        }
    }

    protected static List<String> parseList(String lst) {
        List<String> ret = new ArrayList<>();
        lst = lst.replaceAll("[\\[\\]]", "");

        for (String n : lst.split(",")) {
            if (!n.trim().isEmpty()) {
                ret.add(n.trim());
            }
        }

        return ret;
    }

    @SuppressWarnings("unchecked")
    public <T extends Settings> T copy() {
        try {
            T ret = (T) getClass().getConstructor().newInstance();

            for (Field f : getSettingFields()) {
                Object v = f.get(this);

                if (v instanceof List) {
                    f.set(ret, new ArrayList<>((List<?>) v));
                } else if (v instanceof Map) {
                    f.set(ret, new LinkedHashMap<>((Map<?, ?>) v));
                } else {
                    f.set(ret, v);
                }
            }

            return ret;
        } catch (ReflectiveOperationException e) {
            throw new ConfigurationException("Failed to copy settings for " + getClass().getName(), e);
        }
    }

    @SuppressWarnings("unchecked")
    public <T extends Settings> T copyWith(Consumer<T> mutator) {
        T c = (T) copy();

        if (mutator != null) {
            mutator.accept(c);
        }

        return c;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }

        if (other == null || getClass() != other.getClass()) {
            return false;
        }

        try {
            for (Field f : getSettingFields()) {
                if (!Objects.equals(f.get(this), f.get(other))) {
                    return false;
                }
            }
        } catch (IllegalAccessException e) {
            throw new IllegalStateException(e);
        }

        return true;
    }

    @Override
    public int hashCode() {
        int result = 1;

        try {
            for (Field f : getSettingFields()) {
                result = 31 * result + Objects.hashCode(f.get(this));
            }
        } catch (IllegalAccessException e) {
            throw new IllegalStateException(e);
        }

        return result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + asProperties();
    }
}
