package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.DirectoryUser;

/**
 * Interface para montagem das mensagens de alerta por canal
 */
public interface INotificationTemplateService {

    /**
     * Renderiza o modelo do tipo de alerta para o canal e personaliza para o
     * destinatário (nome, área e chamada à ação do papel).
     *
     * @param user usuário do diretório; null quando desconhecido, sem personalização
     */
    NotificationContent render(Alert alert, Alert.DeliveryChannel channel, DirectoryUser user);
}
