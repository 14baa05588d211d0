package com.seveninterprise.healthalert.exceptions;

/**
 * Exception base para operações do motor de alertas
 */
public class AlertException extends RuntimeException {

    public AlertException(String message) {
        super(message);
    }

    public AlertException(String message, Throwable cause) {
        super(message, cause);
    }
}
