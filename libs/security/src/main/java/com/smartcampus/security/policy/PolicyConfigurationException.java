package com.smartcampus.security.policy;

/**
 * Thrown when a policy table cannot be loaded or violates a table-level constraint.
 * <p>
 * At startup this aborts the application; on reload the previous table stays in effect.
 */
public class PolicyConfigurationException extends RuntimeException {

    public PolicyConfigurationException(String message) {
        super(message);
    }

    public PolicyConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
