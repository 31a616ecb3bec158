package com.questrail.logic.schema;

import java.util.Objects;
import java.util.Optional;

/**
 * One named field of a {@link Schema}.
 *
 * @param name       wire key (the record component name)
 * @param kind       declared wire kind
 * @param javaType   erased Java type of the record component
 * @param nested     schema of a nested record; {@code null} unless {@code kind == OBJECT}
 */
public record FieldDescriptor(
        String name,
        FieldKind kind,
        Class<?> javaType,
        Schema<?> nested
) {
    public FieldDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(javaType, "javaType");
        if ((kind == FieldKind.OBJECT) != (nested != null)) {
            throw new IllegalArgumentException("nested schema must be present exactly for OBJECT fields: " + name);
        }
    }

    public Optional<Schema<?>> nestedSchema() {
        return Optional.ofNullable(nested);
    }
}
