package com.seveninterprise.healthalert.exceptions;

import com.seveninterprise.healthalert.model.Alert;

/**
 * Operação não permitida no status atual do alerta
 */
public class AlertClosedException extends AlertException {

    private final Alert.AlertStatus status;

    public AlertClosedException(String alertId, Alert.AlertStatus status, String operation) {
        super("Operação '" + operation + "' não permitida: alerta " + alertId + " está " + status);
        this.status = status;
    }

    public Alert.AlertStatus getStatus() {
        return status;
    }
}
