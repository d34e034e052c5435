package io.constela.core.evaluate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.POJONode;

/** Globals visible to {@code var} expressions when no local of the same name exists. */
public enum BuiltinGlobal {
    MATH("Math", "[object Math]"),
    DATE("Date", "function Date() { [native code] }");

    private final String globalName;
    private final String jsString;
    private final JsonNode node;

    BuiltinGlobal(String globalName, String jsString) {
        this.globalName = globalName;
        this.jsString = jsString;
        this.node = new POJONode(this);
    }

    public String globalName() {
        return globalName;
    }

    String toJsString() {
        return jsString;
    }

    /** The value as seen by expressions. */
    public JsonNode node() {
        return node;
    }

    /** Resolves a global by name, or null. */
    public static BuiltinGlobal byName(String name) {
        for (BuiltinGlobal global : values()) {
            if (global.globalName.equals(name)) {
                return global;
            }
        }
        return null;
    }
}
