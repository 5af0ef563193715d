package de.caluga.topology.driver.commands;

import de.caluga.topology.driver.Doc;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Base of all commands. The command document is built from the non-null, non-transient fields of the
 * concrete class, the command name comes first.
 */
public abstract class MongoCommand<T extends MongoCommand<T>> {
    private String $db;
    private transient String coll;
    private String comment;

    public String getDb() {
        return $db;
    }

    @SuppressWarnings("unchecked")
    public T setDb(String db) {
        this.$db = db;
        return (T) this;
    }

    public String getColl() {
        return coll;
    }

    @SuppressWarnings("unchecked")
    public T setColl(String coll) {
        this.coll = coll;
        return (T) this;
    }

    public String getComment() {
        return comment;
    }

    @SuppressWarnings("unchecked")
    public T setComment(String c) {
        comment = c;
        return (T) this;
    }

    public abstract String getCommandName();

    /**
     * value of the first key in the command document, the collection name by default
     */
    protected Object getCommandValue() {
        return getColl();
    }

    public Map<String, Object> asMap() {
        Doc map = new Doc();
        map.put(getCommandName(), getCommandValue());

        for (Field f : getAllFields(getClass())) {
            if (Modifier.isStatic(f.getModifiers()) || Modifier.isTransient(f.getModifiers())) {
                continue;
            }

            f.setAccessible(true);

            try {
                Object v = f.get(this);

                if (v instanceof Enum) {
                    v = v.toString();
                }

                if (v != null) {
                    map.put(f.getName(), v);
                }
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("cannot access field " + f.getName(), e);
            }
        }

        return map;
    }

    private static List<Field> getAllFields(Class<?> cls) {
        List<Field> ret = new ArrayList<>();
        List<Class<?>> hierarchy = new ArrayList<>();

        for (Class<?> c = cls; c != null && !c.equals(Object.class); c = c.getSuperclass()) {
            hierarchy.add(0, c);
        }

        for (Class<?> c : hierarchy) {
            for (Field f : c.getDeclaredFields()) {
                if (!f.isSynthetic()) {
                    ret.add(f);
                }
            }
        }

        return ret;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + asMap();
    }
}
