package com.smartcampus.security.audit;

/**
 * Thrown by an {@link AuditStore} that could not persist an entry. Sinks catch it and
 * raise an operational alert; it never reaches request handling.
 */
public class AuditWriteException extends RuntimeException {

    public AuditWriteException(String message) {
        super(message);
    }

    public AuditWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
