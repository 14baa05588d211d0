package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adaptador padrão: registra o envio em log e o considera aceito
 */
public class LoggingChannelSender implements IChannelSender {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingChannelSender.class);

    @Override
    public ChannelSendResult send(String recipientId, Alert.DeliveryChannel channel, NotificationContent content) {
        LOGGER.info("📨 [DELIVERY] {} -> {}: {}", channel, recipientId, content);
        return ChannelSendResult.accepted();
    }
}
