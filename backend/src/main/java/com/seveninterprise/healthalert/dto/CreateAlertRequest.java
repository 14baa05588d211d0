package com.seveninterprise.healthalert.dto;

import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.EscalationRule;
import com.seveninterprise.healthalert.model.UserRole;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Requisição de criação de alerta (trigger API)
 *
 * Campos opcionais recebem os padrões do motor: canais SMS/EMAIL/PUSH,
 * auto-escalação habilitada, auto-arquivamento após 30 dias e
 * prioridade derivada do nível.
 */
public class CreateAlertRequest {

    private Alert.AlertSourceKind sourceKind;
    private Alert.SourceModel sourceModel;
    private String sourceId;

    @NotNull(message = "Alert type is required")
    private Alert.AlertType alertType;

    @NotBlank(message = "Title is required")
    @Size(max = 150, message = "Title cannot exceed 150 characters")
    private String title;

    @NotBlank(message = "Message is required")
    @Size(max = 1000, message = "Message cannot exceed 1000 characters")
    private String message;

    @NotNull(message = "Alert level is required")
    private Alert.AlertLevel level;

    private Alert.AlertPriority priority; // Opcional, padrão derivado do nível

    @Valid
    private AffectedAreas affectedAreas = new AffectedAreas();

    @NotNull(message = "Target audience is required")
    @Valid
    private TargetAudience targetAudience;

    @Valid
    private DeliveryConfig delivery = new DeliveryConfig();

    @Valid
    private List<EscalationRuleRequest> escalationRules = new ArrayList<>();

    private Boolean autoEscalationEnabled;
    private Boolean autoEscalate;

    @Valid
    private ExpirationConfig expiration = new ExpirationConfig();

    private String category;
    private Set<String> tags = new LinkedHashSet<>();
    private String externalReference;

    public static class AffectedAreas {
        private Set<String> villages = new LinkedHashSet<>();
        private Set<String> blocks = new LinkedHashSet<>();
        private Set<String> districts = new LinkedHashSet<>();
        private Double centerLatitude;
        private Double centerLongitude;
        private Double radiusKm;

        public Set<String> getVillages() {
            return villages;
        }

        public void setVillages(Set<String> villages) {
            this.villages = villages;
        }

        public Set<String> getBlocks() {
            return blocks;
        }

        public void setBlocks(Set<String> blocks) {
            this.blocks = blocks;
        }

        public Set<String> getDistricts() {
            return districts;
        }

        public void setDistricts(Set<String> districts) {
            this.districts = districts;
        }

        public Double getCenterLatitude() {
            return centerLatitude;
        }

        public void setCenterLatitude(Double centerLatitude) {
            this.centerLatitude = centerLatitude;
        }

        public Double getCenterLongitude() {
            return centerLongitude;
        }

        public void setCenterLongitude(Double centerLongitude) {
            this.centerLongitude = centerLongitude;
        }

        public Double getRadiusKm() {
            return radiusKm;
        }

        public void setRadiusKm(Double radiusKm) {
            this.radiusKm = radiusKm;
        }
    }

    public static class TargetAudience {
        @NotNull(message = "Audience type is required")
        private Alert.AudienceType type;
        private List<String> userIds = new ArrayList<>();
        private Set<UserRole> roles = new LinkedHashSet<>();
        private Integer minAge;
        private Integer maxAge;
        private String gender;
        private String location;
        private Set<String> healthConditions = new LinkedHashSet<>();

        public TargetAudience() {}

        public TargetAudience(Alert.AudienceType type) {
            this.type = type;
        }

        public Alert.AudienceType getType() {
            return type;
        }

        public void setType(Alert.AudienceType type) {
            this.type = type;
        }

        public List<String> getUserIds() {
            return userIds;
        }

        public void setUserIds(List<String> userIds) {
            this.userIds = userIds;
        }

        public Set<UserRole> getRoles() {
            return roles;
        }

        public void setRoles(Set<UserRole> roles) {
            this.roles = roles;
        }

        public Integer getMinAge() {
            return minAge;
        }

        public void setMinAge(Integer minAge) {
            this.minAge = minAge;
        }

        public Integer getMaxAge() {
            return maxAge;
        }

        public void setMaxAge(Integer maxAge) {
            this.maxAge = maxAge;
        }

        public String getGender() {
            return gender;
        }

        public void setGender(String gender) {
            this.gender = gender;
        }

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }

        public Set<String> getHealthConditions() {
            return healthConditions;
        }

        public void setHealthConditions(Set<String> healthConditions) {
            this.healthConditions = healthConditions;
        }
    }

    public static class DeliveryConfig {
        private List<Alert.DeliveryChannel> channels = new ArrayList<>();
        private LocalDateTime scheduledFor;
        private String timezone;
        private Alert.RecurrenceInterval recurrenceInterval;
        private LocalDateTime recurrenceEndDate;

        public List<Alert.DeliveryChannel> getChannels() {
            return channels;
        }

        public void setChannels(List<Alert.DeliveryChannel> channels) {
            this.channels = channels;
        }

        public LocalDateTime getScheduledFor() {
            return scheduledFor;
        }

        public void setScheduledFor(LocalDateTime scheduledFor) {
            this.scheduledFor = scheduledFor;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public Alert.RecurrenceInterval getRecurrenceInterval() {
            return recurrenceInterval;
        }

        public void setRecurrenceInterval(Alert.RecurrenceInterval recurrenceInterval) {
            this.recurrenceInterval = recurrenceInterval;
        }

        public LocalDateTime getRecurrenceEndDate() {
            return recurrenceEndDate;
        }

        public void setRecurrenceEndDate(LocalDateTime recurrenceEndDate) {
            this.recurrenceEndDate = recurrenceEndDate;
        }
    }

    public static class EscalationRuleRequest {
        @NotNull(message = "Escalation condition is required")
        private EscalationRule.EscalationCondition condition;
        @Min(value = 0, message = "Threshold cannot be negative")
        private Integer threshold;
        @NotNull(message = "Escalation action is required")
        private EscalationRule.EscalationAction action;
        private List<String> escalateTo = new ArrayList<>();

        public EscalationRuleRequest() {}

        public EscalationRuleRequest(EscalationRule.EscalationCondition condition, Integer threshold,
                                     EscalationRule.EscalationAction action, List<String> escalateTo) {
            this.condition = condition;
            this.threshold = threshold;
            this.action = action;
            this.escalateTo = escalateTo;
        }

        public EscalationRule.EscalationCondition getCondition() {
            return condition;
        }

        public void setCondition(EscalationRule.EscalationCondition condition) {
            this.condition = condition;
        }

        public Integer getThreshold() {
            return threshold;
        }

        public void setThreshold(Integer threshold) {
            this.threshold = threshold;
        }

        public EscalationRule.EscalationAction getAction() {
            return action;
        }

        public void setAction(EscalationRule.EscalationAction action) {
            this.action = action;
        }

        public List<String> getEscalateTo() {
            return escalateTo;
        }

        public void setEscalateTo(List<String> escalateTo) {
            this.escalateTo = escalateTo;
        }
    }

    public static class ExpirationConfig {
        private LocalDateTime expiresAt;
        private Boolean autoArchive;
        @Min(value = 1, message = "Archive delay must be at least 1 day")
        private Integer archiveAfterDays;

        public LocalDateTime getExpiresAt() {
            return expiresAt;
        }

        public void setExpiresAt(LocalDateTime expiresAt) {
            this.expiresAt = expiresAt;
        }

        public Boolean getAutoArchive() {
            return autoArchive;
        }

        public void setAutoArchive(Boolean autoArchive) {
            this.autoArchive = autoArchive;
        }

        public Integer getArchiveAfterDays() {
            return archiveAfterDays;
        }

        public void setArchiveAfterDays(Integer archiveAfterDays) {
            this.archiveAfterDays = archiveAfterDays;
        }
    }

    public Alert.AlertSourceKind getSourceKind() {
        return sourceKind;
    }

    public void setSourceKind(Alert.AlertSourceKind sourceKind) {
        this.sourceKind = sourceKind;
    }

    public Alert.SourceModel getSourceModel() {
        return sourceModel;
    }

    public void setSourceModel(Alert.SourceModel sourceModel) {
        this.sourceModel = sourceModel;
    }

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    public Alert.AlertType getAlertType() {
        return alertType;
    }

    public void setAlertType(Alert.AlertType alertType) {
        this.alertType = alertType;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Alert.AlertLevel getLevel() {
        return level;
    }

    public void setLevel(Alert.AlertLevel level) {
        this.level = level;
    }

    public Alert.AlertPriority getPriority() {
        return priority;
    }

    public void setPriority(Alert.AlertPriority priority) {
        this.priority = priority;
    }

    public AffectedAreas getAffectedAreas() {
        return affectedAreas;
    }

    public void setAffectedAreas(AffectedAreas affectedAreas) {
        this.affectedAreas = affectedAreas;
    }

    public TargetAudience getTargetAudience() {
        return targetAudience;
    }

    public void setTargetAudience(TargetAudience targetAudience) {
        this.targetAudience = targetAudience;
    }

    public DeliveryConfig getDelivery() {
        return delivery;
    }

    public void setDelivery(DeliveryConfig delivery) {
        this.delivery = delivery;
    }

    public List<EscalationRuleRequest> getEscalationRules() {
        return escalationRules;
    }

    public void setEscalationRules(List<EscalationRuleRequest> escalationRules) {
        this.escalationRules = escalationRules;
    }

    public Boolean getAutoEscalationEnabled() {
        return autoEscalationEnabled;
    }

    public void setAutoEscalationEnabled(Boolean autoEscalationEnabled) {
        this.autoEscalationEnabled = autoEscalationEnabled;
    }

    public Boolean getAutoEscalate() {
        return autoEscalate;
    }

    public void setAutoEscalate(Boolean autoEscalate) {
        this.autoEscalate = autoEscalate;
    }

    public ExpirationConfig getExpiration() {
        return expiration;
    }

    public void setExpiration(ExpirationConfig expiration) {
        this.expiration = expiration;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public Set<String> getTags() {
        return tags;
    }

    public void setTags(Set<String> tags) {
        this.tags = tags;
    }

    public String getExternalReference() {
        return externalReference;
    }

    public void setExternalReference(String externalReference) {
        this.externalReference = externalReference;
    }
}
