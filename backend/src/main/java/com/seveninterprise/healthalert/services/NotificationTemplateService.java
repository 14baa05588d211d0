package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.DirectoryUser;
import com.seveninterprise.healthalert.model.UserRole;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Modelos de mensagem por tipo de alerta × canal
 *
 * O tipo define emoji, rótulo, título curto e orientação; o canal define o
 * formato:
 * - SMS: cabeçalho, título, local, nível e orientação
 * - WhatsApp: igual ao SMS, com a mensagem completa
 * - Voz: frase corrida, sem emoji
 * - Email: assunto e corpo completo com identificador do alerta
 * - Push / in-app: título curto e uma linha de resumo
 *
 * A personalização só toca os canais de texto curto (SMS e WhatsApp), além
 * da saudação no corpo do email.
 */
@Service
public class NotificationTemplateService implements INotificationTemplateService {

    static final String LOCATION_LABEL = "Local: ";

    private static final TypeTemplate GENERIC = new TypeTemplate(
        "🔔", "NOTIFICAÇÃO DE SAÚDE", "Notificação de saúde", "Consulte o aplicativo para mais detalhes.");

    private static final Map<Alert.AlertType, TypeTemplate> TEMPLATES = new EnumMap<>(Alert.AlertType.class);
    private static final Map<UserRole, String> ROLE_CALLS_TO_ACTION = new EnumMap<>(UserRole.class);

    static {
        TEMPLATES.put(Alert.AlertType.HEALTH_EMERGENCY, new TypeTemplate(
            "🚨", "EMERGÊNCIA DE SAÚDE", "Emergência de saúde", "Ação imediata necessária."));
        TEMPLATES.put(Alert.AlertType.DISEASE_OUTBREAK_NOTIFICATION, new TypeTemplate(
            "🦠", "SURTO DE DOENÇA", "Surto de doença", "Siga os protocolos de prevenção."));
        TEMPLATES.put(Alert.AlertType.WATER_CONTAMINATION_WARNING, new TypeTemplate(
            "💧", "CONTAMINAÇÃO DA ÁGUA", "Água contaminada",
            "NÃO use esta água para beber. Ferva por 5 minutos ou use outra fonte."));
        TEMPLATES.put(Alert.AlertType.VACCINATION_REMINDER, new TypeTemplate(
            "💉", "LEMBRETE DE VACINAÇÃO", "Vacinação pendente", "Leve o cartão de vacinação e um documento."));
        TEMPLATES.put(Alert.AlertType.APPOINTMENT_NOTIFICATION, new TypeTemplate(
            "📅", "LEMBRETE DE CONSULTA", "Lembrete de consulta", "Confirme sua presença com a unidade de saúde."));
        TEMPLATES.put(Alert.AlertType.SYSTEM_ALERT, new TypeTemplate(
            "🔧", "ALERTA DO SISTEMA", "Alerta do sistema", "Contate o suporte se precisar de ajuda."));
        TEMPLATES.put(Alert.AlertType.ADMINISTRATIVE_NOTIFICATION, new TypeTemplate(
            "📋", "AVISO ADMINISTRATIVO", "Aviso administrativo", "Verifique os prazos indicados."));

        ROLE_CALLS_TO_ACTION.put(UserRole.ASHA_WORKER, "Como agente ASHA, tome providências imediatas.");
        ROLE_CALLS_TO_ACTION.put(UserRole.MEDICAL_OFFICER, "Revisão do oficial médico necessária.");
        ROLE_CALLS_TO_ACTION.put(UserRole.BLOCK_COORDINATOR, "Supervisão do coordenador de bloco necessária.");
        ROLE_CALLS_TO_ACTION.put(UserRole.DISTRICT_COORDINATOR, "Atenção do coordenador distrital necessária.");
    }

    @Override
    public NotificationContent render(Alert alert, Alert.DeliveryChannel channel, DirectoryUser user) {
        NotificationContent base = baseContent(alert, channel);
        if (user == null) {
            return base;
        }
        return personalize(base, channel, user);
    }

    NotificationContent baseContent(Alert alert, Alert.DeliveryChannel channel) {
        TypeTemplate template = TEMPLATES.getOrDefault(alert.getAlertType(), GENERIC);
        String location = describeLocation(alert);

        switch (channel) {
            case SMS:
                return NotificationContent.of(shortText(template, alert, location));

            case WHATSAPP:
                return NotificationContent.of(shortText(template, alert, location) + "\n\n" + alert.getMessage());

            case VOICE_CALL:
                return NotificationContent.of(voiceText(template, alert, location));

            case EMAIL:
                return NotificationContent.of(
                    template.emoji + " " + template.shortTitle + " - " + alert.getTitle(),
                    emailBody(template, alert, location));

            case PUSH_NOTIFICATION:
            case IN_APP_NOTIFICATION:
            default:
                String summary = alert.getTitle() + (location != null ? " em " + location : "") + ". " + template.action;
                return NotificationContent.of(template.emoji + " " + template.shortTitle, summary);
        }
    }

    NotificationContent personalize(NotificationContent content, Alert.DeliveryChannel channel, DirectoryUser user) {
        String name = user.getName() != null && !user.getName().isBlank() ? user.getName().trim() : null;

        if (channel == Alert.DeliveryChannel.EMAIL) {
            return name != null ? content.withBody("Prezado(a) " + name + ",\n\n" + content.getBody()) : content;
        }
        if (channel != Alert.DeliveryChannel.SMS && channel != Alert.DeliveryChannel.WHATSAPP) {
            return content;
        }

        StringBuilder body = new StringBuilder();
        if (name != null) {
            body.append("Olá ").append(name).append(",\n\n");
        }
        body.append(content.getBody());

        // Área do usuário só quando o modelo não trouxe o local do alerta
        String area = describeUserArea(user);
        if (area != null && !content.getBody().contains(LOCATION_LABEL)) {
            body.append("\n\nSua área: ").append(area);
        }

        String callToAction = user.getRole() != null ? ROLE_CALLS_TO_ACTION.get(user.getRole()) : null;
        if (callToAction != null) {
            body.append("\n\n").append(callToAction);
        }
        return content.withBody(body.toString());
    }

    private String shortText(TypeTemplate template, Alert alert, String location) {
        StringBuilder text = new StringBuilder();
        text.append(template.emoji).append(' ').append(template.label).append('\n');
        text.append(alert.getTitle()).append('\n');
        if (location != null) {
            text.append(LOCATION_LABEL).append(location).append('\n');
        }
        text.append("Nível: ").append(alert.getLevel()).append('\n');
        text.append(template.action);
        return text.toString();
    }

    private String voiceText(TypeTemplate template, Alert alert, String location) {
        return "Alerta de " + template.shortTitle.toLowerCase(Locale.ROOT) + ". "
            + alert.getTitle()
            + (location != null ? ", em " + location : "")
            + ". Nível " + alert.getLevel() + ". "
            + template.action;
    }

    private String emailBody(TypeTemplate template, Alert alert, String location) {
        StringBuilder body = new StringBuilder();
        body.append(template.emoji).append(' ').append(template.label).append("\n\n");
        body.append(alert.getTitle()).append("\n\n");
        body.append(alert.getMessage()).append("\n\n");
        if (location != null) {
            body.append(LOCATION_LABEL).append(location).append('\n');
        }
        body.append("Nível: ").append(alert.getLevel()).append('\n');
        body.append("Prioridade: ").append(alert.getPriority()).append("\n\n");
        body.append(template.action).append("\n\n");
        body.append("Alerta ").append(alert.getAlertId());
        return body.toString();
    }

    /**
     * Áreas afetadas do alerta (vilas, blocos, distritos), ou null se nenhuma
     */
    private String describeLocation(Alert alert) {
        List<String> parts = new ArrayList<>();
        addAll(parts, alert.getAffectedVillages());
        addAll(parts, alert.getAffectedBlocks());
        addAll(parts, alert.getAffectedDistricts());
        return parts.isEmpty() ? null : String.join(", ", parts);
    }

    private String describeUserArea(DirectoryUser user) {
        if (user.getVillageId() == null) {
            return null;
        }
        StringBuilder area = new StringBuilder("Vila ").append(user.getVillageId());
        if (user.getBlockId() != null) {
            area.append(", Bloco ").append(user.getBlockId());
        }
        if (user.getDistrictId() != null) {
            area.append(", Distrito ").append(user.getDistrictId());
        }
        return area.toString();
    }

    private void addAll(List<String> parts, Collection<String> values) {
        if (values == null) {
            return;
        }
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                parts.add(value);
            }
        }
    }

    private static final class TypeTemplate {
        private final String emoji;
        private final String label;
        private final String shortTitle;
        private final String action;

        private TypeTemplate(String emoji, String label, String shortTitle, String action) {
            this.emoji = emoji;
            this.label = label;
            this.shortTitle = shortTitle;
            this.action = action;
        }
    }
}
