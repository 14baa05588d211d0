package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.exceptions.AlertValidationException;
import com.seveninterprise.healthalert.exceptions.NoRecipientsException;
import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.AlertRecipient;
import com.seveninterprise.healthalert.model.DirectoryUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolvedor de destinatários
 *
 * Tipos de público:
 * - INDIVIDUAL_USERS: lista explícita, literal (sem duplicatas, ordem preservada)
 * - ROLE_BASED_GROUPS: usuários ativos com papel no conjunto, restritos às áreas afetadas se houver
 * - GEOGRAPHIC_AREAS: usuários ativos cuja área de atuação intersecta as áreas afetadas
 * - CUSTOM_LIST: usuários ativos que atendem aos critérios demográficos
 * - ALL_USERS: todos os usuários ativos
 *
 * A resolução é idempotente para o mesmo estado do diretório.
 */
@Service
public class RecipientResolverService implements IRecipientResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecipientResolverService.class);
    private static final double EARTH_RADIUS_KM = 6371.0;

    private final IUserDirectory userDirectory;

    public RecipientResolverService(IUserDirectory userDirectory) {
        this.userDirectory = userDirectory;
    }

    @Override
    public List<AlertRecipient> resolveRecipients(Alert alert, LocalDateTime now) {
        Alert.AudienceType audienceType = alert.getAudienceType();
        if (audienceType == null) {
            throw new AlertValidationException("Tipo de público é obrigatório");
        }

        Map<String, DirectoryUser> matched = new LinkedHashMap<>();
        List<String> explicitIds = new ArrayList<>();

        switch (audienceType) {
            case INDIVIDUAL_USERS:
                if (alert.getTargetUsers() == null || alert.getTargetUsers().isEmpty()) {
                    throw new AlertValidationException("Público INDIVIDUAL_USERS exige ao menos um usuário");
                }
                explicitIds.addAll(new LinkedHashSet<>(alert.getTargetUsers()));
                matched.putAll(userDirectory.findUsers(explicitIds));
                break;

            case ROLE_BASED_GROUPS:
                if (alert.getTargetRoles() == null || alert.getTargetRoles().isEmpty()) {
                    throw new AlertValidationException("Público ROLE_BASED_GROUPS exige ao menos um papel");
                }
                boolean restrictToArea = hasAreaFilter(alert);
                for (DirectoryUser user : userDirectory.findActiveUsersByRoles(alert.getTargetRoles())) {
                    if (!restrictToArea || isInAffectedArea(user, alert)) {
                        matched.put(user.getUserId(), user);
                    }
                }
                break;

            case GEOGRAPHIC_AREAS:
                if (!hasAreaFilter(alert)) {
                    throw new AlertValidationException("Público GEOGRAPHIC_AREAS exige áreas afetadas ou centro e raio");
                }
                for (DirectoryUser user : userDirectory.findActiveUsers()) {
                    if (isInAffectedArea(user, alert)) {
                        matched.put(user.getUserId(), user);
                    }
                }
                break;

            case CUSTOM_LIST:
                if (!hasCustomCriteria(alert)) {
                    throw new AlertValidationException("Público CUSTOM_LIST exige ao menos um critério");
                }
                for (DirectoryUser user : userDirectory.findActiveUsers()) {
                    if (matchesCustomCriteria(user, alert)) {
                        matched.put(user.getUserId(), user);
                    }
                }
                break;

            case ALL_USERS:
                for (DirectoryUser user : userDirectory.findActiveUsers()) {
                    matched.put(user.getUserId(), user);
                }
                break;
        }

        Collection<String> userIds = audienceType == Alert.AudienceType.INDIVIDUAL_USERS ? explicitIds : matched.keySet();
        List<AlertRecipient> recipients = new ArrayList<>();
        for (String userId : userIds) {
            recipients.add(buildRecipient(userId, matched.get(userId), alert.getChannels(), 0, now));
        }

        if (recipients.isEmpty()) {
            throw new NoRecipientsException(audienceType);
        }

        LOGGER.debug("👥 Público {} resolvido em {} destinatário(s)", audienceType, recipients.size());
        return recipients;
    }

    @Override
    public List<AlertRecipient> resolveEscalationTargets(Alert alert, List<String> userIds,
                                                         List<Alert.DeliveryChannel> channels,
                                                         int escalationLevel, LocalDateTime now) {
        List<AlertRecipient> recipients = new ArrayList<>();
        if (userIds == null || userIds.isEmpty()) {
            return recipients;
        }

        Set<String> newIds = new LinkedHashSet<>();
        for (String userId : userIds) {
            if (userId != null && !userId.isBlank() && !alert.hasRecipient(userId)) {
                newIds.add(userId);
            }
        }

        Map<String, DirectoryUser> known = userDirectory.findUsers(newIds);
        for (String userId : newIds) {
            recipients.add(buildRecipient(userId, known.get(userId), channels, escalationLevel, now));
        }
        return recipients;
    }

    private AlertRecipient buildRecipient(String userId, DirectoryUser user, List<Alert.DeliveryChannel> channels,
                                          int escalationLevel, LocalDateTime now) {
        AlertRecipient recipient = new AlertRecipient(userId, channels, now);
        recipient.setEscalationLevel(escalationLevel);

        if (user != null) {
            // Preferências do diretório
            for (Alert.DeliveryChannel preferred : user.getPreferredChannels()) {
                if (channels.contains(preferred)) {
                    recipient.setPreferredChannel(preferred);
                    break;
                }
            }
            recipient.setDoNotDisturbEnabled(user.isDoNotDisturbEnabled());
            recipient.setDoNotDisturbStart(user.getDoNotDisturbStart());
            recipient.setDoNotDisturbEnd(user.getDoNotDisturbEnd());
            if (user.getDeliveryFrequency() != null) {
                recipient.setFrequency(user.getDeliveryFrequency());
            }
        }
        return recipient;
    }

    private boolean hasAreaFilter(Alert alert) {
        return !alert.getAffectedVillages().isEmpty()
            || !alert.getAffectedBlocks().isEmpty()
            || !alert.getAffectedDistricts().isEmpty()
            || hasRadius(alert);
    }

    private boolean hasRadius(Alert alert) {
        return alert.getCenterLatitude() != null && alert.getCenterLongitude() != null
            && alert.getRadiusKm() != null && alert.getRadiusKm() > 0;
    }

    private boolean isInAffectedArea(DirectoryUser user, Alert alert) {
        if (user.getVillageId() != null && alert.getAffectedVillages().contains(user.getVillageId())) {
            return true;
        }
        if (user.getBlockId() != null && alert.getAffectedBlocks().contains(user.getBlockId())) {
            return true;
        }
        if (user.getDistrictId() != null && alert.getAffectedDistricts().contains(user.getDistrictId())) {
            return true;
        }
        if (hasRadius(alert) && user.getLatitude() != null && user.getLongitude() != null) {
            double distance = calculateDistance(alert.getCenterLatitude(), alert.getCenterLongitude(),
                                                user.getLatitude(), user.getLongitude());
            return distance <= alert.getRadiusKm();
        }
        return false;
    }

    private boolean hasCustomCriteria(Alert alert) {
        return alert.getCriteriaMinAge() != null
            || alert.getCriteriaMaxAge() != null
            || (alert.getCriteriaGender() != null && !alert.getCriteriaGender().isBlank())
            || (alert.getCriteriaLocation() != null && !alert.getCriteriaLocation().isBlank())
            || !alert.getCriteriaHealthConditions().isEmpty();
    }

    private boolean matchesCustomCriteria(DirectoryUser user, Alert alert) {
        if (alert.getCriteriaMinAge() != null && (user.getAge() == null || user.getAge() < alert.getCriteriaMinAge())) {
            return false;
        }
        if (alert.getCriteriaMaxAge() != null && (user.getAge() == null || user.getAge() > alert.getCriteriaMaxAge())) {
            return false;
        }
        if (alert.getCriteriaGender() != null && !alert.getCriteriaGender().isBlank()
                && !alert.getCriteriaGender().equalsIgnoreCase(user.getGender())) {
            return false;
        }
        if (alert.getCriteriaLocation() != null && !alert.getCriteriaLocation().isBlank()
                && !alert.getCriteriaLocation().equalsIgnoreCase(user.getLocation())) {
            return false;
        }
        if (!alert.getCriteriaHealthConditions().isEmpty()) {
            // Basta uma condição em comum
            return alert.getCriteriaHealthConditions().stream().anyMatch(user.getHealthConditions()::contains);
        }
        return true;
    }

    /**
     * Distância haversine em km
     */
    static double calculateDistance(double lat1, double lon1, double lat2, double lon2) {
        double latDistance = Math.toRadians(lat2 - lat1);
        double lonDistance = Math.toRadians(lon2 - lon1);
        double a = Math.sin(latDistance / 2) * Math.sin(latDistance / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(lonDistance / 2) * Math.sin(lonDistance / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }
}
