package com.seveninterprise.healthalert.exceptions;

import com.seveninterprise.healthalert.model.Alert;

/**
 * A especificação de público não resultou em nenhum destinatário
 */
public class NoRecipientsException extends AlertValidationException {

    public NoRecipientsException(Alert.AudienceType audienceType) {
        super("Nenhum destinatário encontrado para o público " + audienceType);
    }
}
