package com.smartcampus.security;

import java.util.List;

/**
 * Thrown when an authenticated identity cannot be turned into a {@link Principal}.
 * <p>
 * A malformed principal is a programming or upstream-authentication error. It is raised
 * at construction time so that it never reaches policy evaluation; the hosting layer
 * reports it as 401.
 */
public class MalformedPrincipalException extends RuntimeException {

    private final List<String> errors;

    public MalformedPrincipalException(List<String> errors) {
        super("Malformed principal: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
