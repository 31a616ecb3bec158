package com.questrail.logic.schema;

/**
 * Primitive wire kinds a schema field may declare.
 *
 * <p>The kind is derived once from the record component type when a
 * {@link Schema} is built. Decoding checks the incoming value against the
 * kind, never against the Java type directly.</p>
 */
public enum FieldKind
{
    STRING("string"),
    INTEGER("integer"),
    FLOAT("float"),
    BOOLEAN("boolean"),
    BINARY("binary"),
    LIST("list"),
    MAP("map"),
    OBJECT("object");

    private final String wireName;

    FieldKind(String wireName)
    {
        this.wireName = wireName;
    }

    /**
     * Lower-case name used in validation messages and in the registry
     * description handed to stub generators.
     */
    public String wireName()
    {
        return wireName;
    }

    /**
     * Describe the kind of an already-decoded wire value.
     */
    static String describeValue(Object value)
    {
        if (value == null) {
            return "nil";
        }
        if (value instanceof String) {
            return STRING.wireName;
        }
        if (value instanceof Boolean) {
            return BOOLEAN.wireName;
        }
        if (value instanceof Double || value instanceof Float) {
            return FLOAT.wireName;
        }
        if (value instanceof Number) {
            return INTEGER.wireName;
        }
        if (value instanceof byte[]) {
            return BINARY.wireName;
        }
        if (value instanceof java.util.List) {
            return LIST.wireName;
        }
        if (value instanceof java.util.Map) {
            return MAP.wireName;
        }
        return value.getClass().getSimpleName();
    }
}
