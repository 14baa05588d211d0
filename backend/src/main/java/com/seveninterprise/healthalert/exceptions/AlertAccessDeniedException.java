package com.seveninterprise.healthalert.exceptions;

/**
 * Usuário sem permissão para a operação (papel ausente ou não destinatário)
 */
public class AlertAccessDeniedException extends AlertException {

    public AlertAccessDeniedException(String message) {
        super(message);
    }
}
