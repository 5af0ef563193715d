package de.caluga.topology.driver.bson;

import de.caluga.topology.driver.Doc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * reference to a document in another collection. Stored as <code>{$ref, $id, $db?, ...extra}</code>.
 */
public class DBRef {
    private final String collection;
    private final Object id;
    private final String database;
    private final Map<String, Object> extra;

    public DBRef(String collection, Object id) {
        this(collection, id, null, null);
    }

    public DBRef(String collection, Object id, String database) {
        this(collection, id, database, null);
    }

    public DBRef(String collection, Object id, String database, Map<String, Object> extra) {
        if (collection == null) {
            throw new IllegalArgumentException("collection must not be null");
        }

        this.collection = collection;
        this.id = id;
        this.database = database;
        this.extra = extra == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    public String getCollection() {
        return collection;
    }

    public Object getId() {
        return id;
    }

    public String getDatabase() {
        return database;
    }

    public Map<String, Object> getExtra() {
        return extra;
    }

    public Doc asDoc() {
        Doc d = Doc.of("$ref", collection, "$id", id);

        if (database != null) {
            d.put("$db", database);
        }

        d.putAll(extra);
        return d;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DBRef dbRef = (DBRef) o;
        return collection.equals(dbRef.collection) && Objects.equals(id, dbRef.id) && Objects.equals(database, dbRef.database)
            && extra.equals(dbRef.extra);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collection, id, database, extra);
    }

    @Override
    public String toString() {
        return "DBRef" + asDoc();
    }
}
