package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.AlertRecipient;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Expande a especificação de público em destinatários concretos
 */
public interface IRecipientResolver {

    /**
     * Resolve o público do alerta na criação. Nunca retorna lista vazia.
     */
    List<AlertRecipient> resolveRecipients(Alert alert, LocalDateTime now);

    /**
     * Cria destinatários para os ids de uma escalação, ignorando quem já é destinatário
     */
    List<AlertRecipient> resolveEscalationTargets(Alert alert, List<String> userIds,
                                                  List<Alert.DeliveryChannel> channels,
                                                  int escalationLevel, LocalDateTime now);
}
