package com.seveninterprise.healthalert.exceptions;

/**
 * Alerta inexistente para o identificador informado
 */
public class AlertNotFoundException extends AlertException {

    public AlertNotFoundException(String alertId) {
        super("Alerta não encontrado: " + alertId);
    }
}
