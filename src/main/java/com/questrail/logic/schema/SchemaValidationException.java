package com.questrail.logic.schema;

/**
 * Indicates that a value does not fit a {@link Schema}.
 *
 * <p>The message names the offending field by its dotted path, e.g.
 * {@code field 'window.width' expected integer but got string}.</p>
 */
public final class SchemaValidationException extends RuntimeException
{
    public SchemaValidationException(String message) {
        super(message);
    }

    public SchemaValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
