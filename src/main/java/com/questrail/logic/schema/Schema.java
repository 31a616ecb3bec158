package com.questrail.logic.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.lang.reflect.RecordComponent;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Schema
 * =============================================================================
 * Static field descriptor for a parameter or response record.
 *
 * <h2>Definition</h2>
 * A schema is built exactly once, when an API is registered. The record's
 * components are walked and each is mapped to a {@link FieldKind}. Types that
 * cannot be mapped are rejected with {@link SchemaDefinitionException} at that
 * point, so no type inspection happens on the request path.
 *
 * <h2>Decoding</h2>
 * {@link #decode(Map)} checks an untyped wire map against the descriptor:
 * <ul>
 *   <li>every declared field must be present and non-nil</li>
 *   <li>the value must match the field kind; integers must fit the Java width</li>
 *   <li>{@code FLOAT} fields also accept integer values</li>
 *   <li>extra keys are ignored</li>
 * </ul>
 * The checked map is then bound to the record by Jackson, which invokes the
 * canonical constructor. Anything the constructor throws is reported as a
 * validation failure so records can guard their own invariants.
 *
 * <h2>Encoding</h2>
 * {@link #encode(Object)} lets Jackson turn a record into a map, then keeps
 * the declared fields only. Integers are normalized to {@code Long} and floats
 * to {@code Double} so encoded maps compare equal to what a MessagePack round
 * trip produces.
 *
 * @param <T> the described record type
 */
public final class Schema<T>
{
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true)
            .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false)
            .configure(DeserializationFeature.USE_LONG_FOR_INTS, true)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    private static final TypeReference<Map<String, Object>> WIRE_MAP = new TypeReference<>() {};

    private final Class<T> type;
    private final SchemaKind kind;
    private final List<FieldDescriptor> fields;

    private Schema(Class<T> type, SchemaKind kind, List<FieldDescriptor> fields)
    {
        this.type = type;
        this.kind = kind;
        this.fields = List.copyOf(fields);
    }

    /**
     * Describe a handler parameter type.
     *
     * @throws SchemaDefinitionException if the type is not a record implementing
     *         {@link RpcParameters} or has an unsupported component
     */
    public static <P extends RpcParameters> Schema<P> forParameters(Class<P> type)
    {
        return define(type, SchemaKind.PARAMETERS, new HashSet<>());
    }

    /**
     * Describe a handler response type.
     *
     * @throws SchemaDefinitionException if the type is not a record implementing
     *         {@link RpcResponse} or has an unsupported component
     */
    public static <R extends RpcResponse> Schema<R> forResponse(Class<R> type)
    {
        return define(type, SchemaKind.RESPONSE, new HashSet<>());
    }

    public Class<T> type()
    {
        return type;
    }

    public SchemaKind kind()
    {
        return kind;
    }

    public List<FieldDescriptor> fields()
    {
        return fields;
    }

    /**
     * @return {@code true} if {@code value} is an instance of the described type
     */
    public boolean accepts(Object value)
    {
        return type.isInstance(value);
    }

    /**
     * Decode and validate an untyped wire map into the described record.
     *
     * @throws SchemaValidationException if the map does not fit the schema
     */
    public T decode(Map<String, ?> values)
    {
        Map<String, ?> checked = values == null ? Map.of() : values;
        check(checked, "");
        try {
            return MAPPER.convertValue(checked, type);
        } catch (IllegalArgumentException e) {
            throw rejected(e);
        }
    }

    /**
     * Encode a record of the described type into a wire map.
     *
     * @throws SchemaValidationException if {@code value} is not of the described
     *         type or one of its components is {@code null}
     */
    public Map<String, Object> encode(Object value)
    {
        if (!type.isInstance(value)) {
            throw new SchemaValidationException("expected " + type.getSimpleName() + " but got "
                    + (value == null ? "null" : value.getClass().getName()));
        }
        final Map<String, Object> mapped;
        try {
            mapped = MAPPER.convertValue(value, WIRE_MAP);
        } catch (IllegalArgumentException e) {
            throw new SchemaValidationException("cannot encode " + type.getSimpleName() + ": "
                    + messageOf(e), e);
        }
        return toWire(mapped, "");
    }

    @Override
    public String toString()
    {
        return "Schema[" + type.getSimpleName() + ", " + kind + ", " + fields.size() + " fields]";
    }

    // -------------------------------------------------------------------------
    // Definition
    // -------------------------------------------------------------------------

    private static <T> Schema<T> define(Class<T> type, SchemaKind kind, Set<Class<?>> inProgress)
    {
        Objects.requireNonNull(type, "type");

        if (!type.isRecord()) {
            throw new SchemaDefinitionException(type.getName() + " must be a record");
        }
        if (kind == SchemaKind.PARAMETERS && !RpcParameters.class.isAssignableFrom(type)) {
            throw new SchemaDefinitionException(type.getName() + " must implement RpcParameters");
        }
        if (kind == SchemaKind.RESPONSE && !RpcResponse.class.isAssignableFrom(type)) {
            throw new SchemaDefinitionException(type.getName() + " must implement RpcResponse");
        }
        if (!inProgress.add(type)) {
            throw new SchemaDefinitionException(type.getName() + " refers to itself");
        }

        RecordComponent[] components = type.getRecordComponents();
        List<FieldDescriptor> fields = new ArrayList<>(components.length);

        for (RecordComponent component : components) {
            Class<?> componentType = component.getType();
            FieldKind fieldKind = kindOf(type, component.getName(), componentType);

            Schema<?> nested = fieldKind == FieldKind.OBJECT
                    ? define(componentType, SchemaKind.OBJECT, inProgress)
                    : null;

            fields.add(new FieldDescriptor(component.getName(), fieldKind, componentType, nested));
        }

        inProgress.remove(type);
        return new Schema<>(type, kind, fields);
    }

    private static FieldKind kindOf(Class<?> owner, String name, Class<?> t)
    {
        if (t == String.class) {
            return FieldKind.STRING;
        }
        if (t == int.class || t == long.class || t == short.class || t == byte.class
                || t == Integer.class || t == Long.class || t == Short.class || t == Byte.class) {
            return FieldKind.INTEGER;
        }
        if (t == double.class || t == float.class || t == Double.class || t == Float.class) {
            return FieldKind.FLOAT;
        }
        if (t == boolean.class || t == Boolean.class) {
            return FieldKind.BOOLEAN;
        }
        if (t == byte[].class) {
            return FieldKind.BINARY;
        }
        if (t == List.class) {
            return FieldKind.LIST;
        }
        if (t == Map.class) {
            return FieldKind.MAP;
        }
        if (t.isRecord()) {
            return FieldKind.OBJECT;
        }
        throw new SchemaDefinitionException("field '" + name + "' of " + owner.getName()
                + " has unsupported type " + t.getName());
    }

    // -------------------------------------------------------------------------
    // Decoding
    // -------------------------------------------------------------------------

    private void check(Map<?, ?> values, String path)
    {
        for (FieldDescriptor field : fields) {
            String fieldPath = path.isEmpty() ? field.name() : path + "." + field.name();

            Object raw = values.get(field.name());
            if (raw == null) {
                throw new SchemaValidationException("field '" + fieldPath + "' is required");
            }
            if (!fits(field, raw, fieldPath)) {
                throw new SchemaValidationException("field '" + fieldPath + "' expected "
                        + field.kind().wireName() + " but got " + FieldKind.describeValue(raw));
            }
        }
    }

    private static boolean fits(FieldDescriptor field, Object value, String path)
    {
        return switch (field.kind()) {
            case STRING -> value instanceof String;
            case BOOLEAN -> value instanceof Boolean;
            case INTEGER -> isIntegral(value) && inRange(field.javaType(), value, path);
            case FLOAT -> value instanceof Number;
            case BINARY -> value instanceof byte[];
            case LIST -> value instanceof List<?>;
            case MAP -> value instanceof Map<?, ?>;
            case OBJECT -> value instanceof Map<?, ?> map && checkNested(field.nested(), map, path);
        };
    }

    private static boolean checkNested(Schema<?> nested, Map<?, ?> map, String path)
    {
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) {
                throw new SchemaValidationException("field '" + path + "' has non-string key " + key);
            }
        }
        nested.check(map, path);
        return true;
    }

    private static boolean isIntegral(Object value)
    {
        return value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }

    private static boolean inRange(Class<?> target, Object value, String path)
    {
        BigInteger big = value instanceof BigInteger b ? b : BigInteger.valueOf(((Number) value).longValue());

        long min;
        long max;
        if (target == int.class || target == Integer.class) {
            min = Integer.MIN_VALUE;
            max = Integer.MAX_VALUE;
        } else if (target == short.class || target == Short.class) {
            min = Short.MIN_VALUE;
            max = Short.MAX_VALUE;
        } else if (target == byte.class || target == Byte.class) {
            min = Byte.MIN_VALUE;
            max = Byte.MAX_VALUE;
        } else {
            min = Long.MIN_VALUE;
            max = Long.MAX_VALUE;
        }

        if (big.compareTo(BigInteger.valueOf(min)) < 0 || big.compareTo(BigInteger.valueOf(max)) > 0) {
            throw new SchemaValidationException("field '" + path + "' value " + big
                    + " is out of range for " + target.getSimpleName());
        }
        return true;
    }

    /**
     * Translate a Jackson binding failure. A constructor exception is unwrapped
     * and reported with its own message, prefixed by the nested field path.
     */
    private static SchemaValidationException rejected(IllegalArgumentException e)
    {
        if (!(e.getCause() instanceof JsonMappingException mapping)) {
            return new SchemaValidationException(messageOf(e), e);
        }

        String path = pathOf(mapping);
        String prefix = path.isEmpty() ? "" : "field '" + path + "': ";

        Throwable cause = mapping.getCause();
        if (cause == null || cause instanceof JsonProcessingException) {
            return new SchemaValidationException(prefix + mapping.getOriginalMessage(), mapping);
        }
        return new SchemaValidationException(prefix + messageOf(cause), cause);
    }

    private static String pathOf(JsonMappingException e)
    {
        StringBuilder path = new StringBuilder();
        for (JsonMappingException.Reference ref : e.getPath()) {
            if (ref.getFieldName() == null) {
                continue;
            }
            if (path.length() > 0) {
                path.append('.');
            }
            path.append(ref.getFieldName());
        }
        return path.toString();
    }

    private static String messageOf(Throwable t)
    {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    // -------------------------------------------------------------------------
    // Encoding
    // -------------------------------------------------------------------------

    private Map<String, Object> toWire(Map<?, ?> mapped, String path)
    {
        Map<String, Object> out = new LinkedHashMap<>();

        for (FieldDescriptor field : fields) {
            String fieldPath = path.isEmpty() ? field.name() : path + "." + field.name();

            Object component = mapped.get(field.name());
            if (component == null) {
                throw new SchemaValidationException("field '" + fieldPath + "' is null");
            }
            out.put(field.name(), switch (field.kind()) {
                case INTEGER -> ((Number) component).longValue();
                case FLOAT -> ((Number) component).doubleValue();
                case OBJECT -> field.nested().toWire((Map<?, ?>) component, fieldPath);
                default -> component;
            });
        }
        return out;
    }
}
