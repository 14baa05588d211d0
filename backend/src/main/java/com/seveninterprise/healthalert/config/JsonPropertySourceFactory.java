package com.seveninterprise.healthalert.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PropertySourceFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Factory para criar PropertySource a partir do arquivo config.json
 *
 * Seções:
 * - main: parâmetros do motor (varreduras, entrega, locks, JWT)
 * - dev: sobrescritas de desenvolvimento, expostas com prefixo "dev."
 *
 * Objetos aninhados são achatados com ponto (ex: {"healthalert": {"lock": {"stripes": 256}}}
 * vira healthalert.lock.stripes).
 */
public class JsonPropertySourceFactory implements PropertySourceFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonPropertySourceFactory.class);

    @Override
    public PropertySource<?> createPropertySource(String name, EncodedResource resource) throws IOException {
        Map<String, Object> properties = new HashMap<>();

        try {
            ObjectMapper mapper = new ObjectMapper();
            JsonNode rootNode = mapper.readTree(resource.getInputStream());

            JsonNode mainNode = rootNode.get("main");
            if (mainNode != null) {
                flatten(mainNode, properties, "");
            }

            JsonNode devNode = rootNode.get("dev");
            if (devNode != null) {
                flatten(devNode, properties, "dev.");
            }

            LOGGER.info("✅ Carregadas {} propriedades do config.json", properties.size());

        } catch (IOException e) {
            LOGGER.error("❌ Erro ao carregar config.json: {}", e.getMessage());
            throw new IOException("Falha ao carregar config.json", e);
        }

        return new MapPropertySource(name != null ? name : "jsonConfig", properties);
    }

    private void flatten(JsonNode node, Map<String, Object> properties, String prefix) {
        node.fields().forEachRemaining(entry -> {
            String key = prefix + entry.getKey();
            JsonNode value = entry.getValue();

            if (value.isObject()) {
                flatten(value, properties, key + ".");
            } else if (value.isTextual()) {
                properties.put(key, value.asText());
            } else if (value.isInt()) {
                properties.put(key, value.asInt());
            } else if (value.isIntegralNumber()) {
                properties.put(key, value.asLong());
            } else if (value.isNumber()) {
                properties.put(key, value.asDouble());
            } else if (value.isBoolean()) {
                properties.put(key, value.asBoolean());
            } else {
                properties.put(key, value.asText());
            }
        });
    }
}
