package com.seveninterprise.healthalert.config;

import com.seveninterprise.healthalert.services.GatewayChannelSender;
import com.seveninterprise.healthalert.services.IChannelSender;
import com.seveninterprise.healthalert.services.LoggingChannelSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Seleciona o adaptador do gateway de canais
 *
 * Com healthalert.delivery.gateway.url vazio os envios apenas são registrados em log.
 */
@Configuration
public class ChannelSenderConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChannelSenderConfig.class);

    @Value("${healthalert.delivery.gateway.url:}")
    private String gatewayUrl;

    @Value("${healthalert.delivery.send.timeout:10}")
    private int sendTimeoutSeconds;

    @Bean
    public IChannelSender channelSender(RestTemplateBuilder restTemplateBuilder) {
        if (gatewayUrl == null || gatewayUrl.isBlank()) {
            LOGGER.info("📭 [DELIVERY] Gateway não configurado - usando envio apenas em log");
            return new LoggingChannelSender();
        }

        LOGGER.info("📡 [DELIVERY] Gateway de canais configurado: {}", gatewayUrl);
        return new GatewayChannelSender(
            restTemplateBuilder
                .setConnectTimeout(Duration.ofSeconds(sendTimeoutSeconds))
                .setReadTimeout(Duration.ofSeconds(sendTimeoutSeconds))
                .build(),
            gatewayUrl);
    }
}
