package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Adaptador HTTP para o gateway de canais
 *
 * POST {gatewayUrl}/{canal} com {recipientId, channel, subject, content}; qualquer
 * resposta 2xx é aceita, o restante vira falha registrada.
 */
public class GatewayChannelSender implements IChannelSender {

    private static final Logger LOGGER = LoggerFactory.getLogger(GatewayChannelSender.class);

    private final RestTemplate restTemplate;
    private final String gatewayUrl;

    public GatewayChannelSender(RestTemplate restTemplate, String gatewayUrl) {
        this.restTemplate = restTemplate;
        this.gatewayUrl = gatewayUrl.endsWith("/") ? gatewayUrl.substring(0, gatewayUrl.length() - 1) : gatewayUrl;
    }

    @Override
    public ChannelSendResult send(String recipientId, Alert.DeliveryChannel channel, NotificationContent content) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("recipientId", recipientId);
        payload.put("channel", channel.name());
        if (content.getSubject() != null) {
            payload.put("subject", content.getSubject());
        }
        payload.put("content", content.getBody());

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                gatewayUrl + "/" + channel.name().toLowerCase(), payload, String.class);
            if (response.getStatusCode().is2xxSuccessful()) {
                return ChannelSendResult.accepted();
            }
            return ChannelSendResult.failed("Gateway respondeu " + response.getStatusCode().value());
        } catch (RestClientException e) {
            LOGGER.warn("⚠️ [DELIVERY] Falha no gateway para {} via {}: {}", recipientId, channel, e.getMessage());
            return ChannelSendResult.failed(e.getMessage());
        }
    }
}
