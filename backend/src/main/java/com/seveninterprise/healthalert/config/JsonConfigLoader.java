package com.seveninterprise.healthalert.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

/**
 * Registra o config.json como fonte de propriedades do motor de alertas
 *
 * Propriedades do application.properties (e do perfil ativo) têm precedência.
 */
@Configuration
@PropertySource(value = "classpath:config.json", factory = JsonPropertySourceFactory.class)
public class JsonConfigLoader {
}
