package com.questrail.logic.schema;

/**
 * Raised at registration time when a parameter or response type cannot be
 * described as a {@link Schema}.
 *
 * This typically reflects:
 * <ul>
 *   <li>A type that is not a record</li>
 *   <li>A type outside the required root kind</li>
 *   <li>A record component whose type has no wire kind</li>
 * </ul>
 */
public final class SchemaDefinitionException extends RuntimeException
{
    public SchemaDefinitionException(String message) {
        super(message);
    }

    public SchemaDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
