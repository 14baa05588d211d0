package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.model.Alert;

/**
 * Porta para o gateway externo de SMS/email/push
 *
 * Tratado como caixa-preta: falhas devem ser devolvidas como resultado,
 * o dispatcher aplica o timeout por chamada.
 */
public interface IChannelSender {

    ChannelSendResult send(String recipientId, Alert.DeliveryChannel channel, NotificationContent content);
}
