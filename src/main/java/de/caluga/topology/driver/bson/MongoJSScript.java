package de.caluga.topology.driver.bson;

import java.util.Map;
import java.util.Objects;

/**
 * JavaScript code, optionally with scope
 **/
public class MongoJSScript {
    private final String js;
    private final Map<String, Object> scope;

    public MongoJSScript(String js, Map<String, Object> scope) {
        this.js = js;
        this.scope = scope;
    }

    public MongoJSScript(String js) {
        this(js, null);
    }

    public String getJs() {
        return js;
    }

    public Map<String, Object> getScope() {
        return scope;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MongoJSScript that = (MongoJSScript) o;
        return Objects.equals(js, that.js) && Objects.equals(scope, that.scope);
    }

    @Override
    public int hashCode() {
        return Objects.hash(js, scope);
    }

    @Override
    public String toString() {
        return "Code{" + js + (scope == null ? "" : ", scope=" + scope) + '}';
    }
}
