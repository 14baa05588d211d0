package com.seveninterprise.healthalert.exceptions;

/**
 * Requisição inválida: campos obrigatórios, regra de escalação malformada,
 * expiração anterior à criação ou segmentação impossível de resolver
 */
public class AlertValidationException extends AlertException {

    public AlertValidationException(String message) {
        super(message);
    }
}
