package com.seveninterprise.healthalert.model;

import jakarta.persistence.*;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registro persistente de um alerta de vigilância em saúde
 *
 * Agrega:
 * - Origem e classificação (tipo, nível, prioridade)
 * - Segmentação (áreas afetadas e público-alvo)
 * - Entrega (canais, agendamento, estatísticas agregadas, tentativas)
 * - Escalação (regras, cadeia, timers)
 * - Reconhecimentos e resolução
 *
 * As sub-coleções são tabelas filhas chaveadas pelo alerta; toda mutação
 * passa pelo AlertLockManager e termina com recomputeDeliveryStatistics().
 */
@Entity
@Table(name = "alerts", indexes = {
    @Index(name = "idx_alerts_status", columnList = "status"),
    @Index(name = "idx_alerts_expiration", columnList = "expires_at, auto_archive"),
    @Index(name = "idx_alerts_type_created", columnList = "alert_type, created_at")
})
public class Alert {

    public enum AlertStatus {
        ACTIVE,         // Aguardando reconhecimento
        ACKNOWLEDGED,   // Limiar de reconhecimento atingido
        RESOLVED,       // Resolvido por operador ou automação
        EXPIRED,        // Marcado como expirado explicitamente
        CANCELLED,      // Cancelado por operador
        ARCHIVED        // Retirado do conjunto ativo pela varredura
    }

    public enum AlertLevel {
        INFO(240),
        WARNING(60),
        CRITICAL(30),
        EMERGENCY(15);

        private final int escalationDelayMinutes;

        AlertLevel(int escalationDelayMinutes) {
            this.escalationDelayMinutes = escalationDelayMinutes;
        }

        public int getEscalationDelayMinutes() {
            return escalationDelayMinutes;
        }

        public AlertLevel next() {
            AlertLevel[] levels = values();
            return ordinal() < levels.length - 1 ? levels[ordinal() + 1] : this;
        }

        /**
         * Prioridade inicial quando o chamador não informa uma
         */
        public AlertPriority defaultPriority() {
            switch (this) {
                case EMERGENCY:
                    return AlertPriority.EMERGENCY;
                case CRITICAL:
                    return AlertPriority.URGENT;
                case WARNING:
                    return AlertPriority.MEDIUM;
                case INFO:
                default:
                    return AlertPriority.LOW;
            }
        }
    }

    public enum AlertPriority {
        LOW,
        MEDIUM,
        HIGH,
        URGENT,
        EMERGENCY;

        /**
         * Próximo nível de prioridade, limitado a EMERGENCY
         */
        public AlertPriority next() {
            AlertPriority[] priorities = values();
            return ordinal() < priorities.length - 1 ? priorities[ordinal() + 1] : this;
        }
    }

    public enum AlertType {
        HEALTH_EMERGENCY,
        DISEASE_OUTBREAK_NOTIFICATION,
        WATER_CONTAMINATION_WARNING,
        VACCINATION_REMINDER,
        APPOINTMENT_NOTIFICATION,
        SYSTEM_ALERT,
        ADMINISTRATIVE_NOTIFICATION,
        PROGRAM_UPDATE,
        COMPLIANCE_ALERT,
        INFRASTRUCTURE_ALERT,
        WEATHER_ALERT,
        SUPPLY_CHAIN_ALERT
    }

    public enum AlertSourceKind {
        USER,
        SYSTEM,
        AUTOMATED_PROCESS,
        EXTERNAL_SYSTEM
    }

    public enum SourceModel {
        USER,
        HEALTH_REPORT,
        WATER_QUALITY_TEST,
        PATIENT_RECORD,
        VACCINATION_RECORD,
        HEALTH_PROGRAM,
        COMMUNITY_OBSERVATION
    }

    public enum AudienceType {
        INDIVIDUAL_USERS,
        ROLE_BASED_GROUPS,
        GEOGRAPHIC_AREAS,
        ALL_USERS,
        CUSTOM_LIST
    }

    public enum DeliveryChannel {
        SMS,
        EMAIL,
        PUSH_NOTIFICATION,
        WHATSAPP,
        VOICE_CALL,
        IN_APP_NOTIFICATION
    }

    public enum RecurrenceInterval {
        DAILY,
        WEEKLY,
        MONTHLY;

        public LocalDateTime advance(LocalDateTime from) {
            switch (this) {
                case DAILY:
                    return from.plusDays(1);
                case WEEKLY:
                    return from.plusWeeks(1);
                case MONTHLY:
                default:
                    return from.plusMonths(1);
            }
        }
    }

    public static final int DEFAULT_ARCHIVE_AFTER_DAYS = 30;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "alert_id", nullable = false, unique = true, updatable = false, length = 32)
    private String alertId;

    @Version
    private Long version;

    // Origem
    @Enumerated(EnumType.STRING)
    @Column(name = "source_kind", nullable = false)
    private AlertSourceKind sourceKind;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_model")
    private SourceModel sourceModel;

    @Column(name = "source_id")
    private String sourceId;

    @Column(name = "triggered_at", nullable = false)
    private LocalDateTime triggeredAt;

    // Classificação
    @Enumerated(EnumType.STRING)
    @Column(name = "alert_type", nullable = false)
    private AlertType alertType;

    @Column(name = "title", nullable = false, length = 150)
    private String title;

    @Column(name = "message", nullable = false, length = 1000)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "alert_level", nullable = false)
    private AlertLevel level;

    // Áreas afetadas
    @ElementCollection
    @CollectionTable(name = "alert_affected_villages", joinColumns = @JoinColumn(name = "alert_pk"))
    @Column(name = "village_id")
    private Set<String> affectedVillages = new LinkedHashSet<>();

    @ElementCollection
    @CollectionTable(name = "alert_affected_blocks", joinColumns = @JoinColumn(name = "alert_pk"))
    @Column(name = "block_id")
    private Set<String> affectedBlocks = new LinkedHashSet<>();

    @ElementCollection
    @CollectionTable(name = "alert_affected_districts", joinColumns = @JoinColumn(name = "alert_pk"))
    @Column(name = "district_id")
    private Set<String> affectedDistricts = new LinkedHashSet<>();

    @Column(name = "center_latitude")
    private Double centerLatitude;

    @Column(name = "center_longitude")
    private Double centerLongitude;

    @Column(name = "radius_km")
    private Double radiusKm;

    // Público-alvo
    @Enumerated(EnumType.STRING)
    @Column(name = "audience_type", nullable = false)
    private AudienceType audienceType;

    @ElementCollection
    @CollectionTable(name = "alert_target_users", joinColumns = @JoinColumn(name = "alert_pk"))
    @OrderColumn(name = "list_index")
    @Column(name = "user_id")
    private List<String> targetUsers = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "alert_target_roles", joinColumns = @JoinColumn(name = "alert_pk"))
    @Enumerated(EnumType.STRING)
    @Column(name = "user_role")
    private Set<UserRole> targetRoles = new LinkedHashSet<>();

    @Column(name = "criteria_min_age")
    private Integer criteriaMinAge;

    @Column(name = "criteria_max_age")
    private Integer criteriaMaxAge;

    @Column(name = "criteria_gender")
    private String criteriaGender;

    @Column(name = "criteria_location")
    private String criteriaLocation;

    @ElementCollection
    @CollectionTable(name = "alert_criteria_conditions", joinColumns = @JoinColumn(name = "alert_pk"))
    @Column(name = "health_condition")
    private Set<String> criteriaHealthConditions = new LinkedHashSet<>();

    // Expiração
    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(name = "auto_archive", nullable = false)
    private boolean autoArchive = true;

    @Column(name = "archive_after_days", nullable = false)
    private int archiveAfterDays = DEFAULT_ARCHIVE_AFTER_DAYS;

    // Entrega
    @ElementCollection
    @CollectionTable(name = "alert_channels", joinColumns = @JoinColumn(name = "alert_pk"))
    @OrderColumn(name = "list_index")
    @Enumerated(EnumType.STRING)
    @Column(name = "channel")
    private List<DeliveryChannel> channels = new ArrayList<>();

    @Column(name = "scheduled_for")
    private LocalDateTime scheduledFor;

    @Column(name = "delivery_timezone")
    private String timezone = "Asia/Kolkata";

    @Enumerated(EnumType.STRING)
    @Column(name = "recurrence_interval")
    private RecurrenceInterval recurrenceInterval;

    @Column(name = "recurrence_end_date")
    private LocalDateTime recurrenceEndDate;

    @Column(name = "last_dispatched_at")
    private LocalDateTime lastDispatchedAt;

    @Embedded
    private DeliveryStatistics deliveryStatistics = new DeliveryStatistics();

    @OneToMany(mappedBy = "alert", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<AlertRecipient> recipients = new ArrayList<>();

    @OneToMany(mappedBy = "alert", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("attemptNumber ASC")
    private List<DeliveryAttempt> deliveryAttempts = new ArrayList<>();

    // Escalação
    @OneToMany(mappedBy = "alert", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<EscalationRule> escalationRules = new ArrayList<>();

    @OneToMany(mappedBy = "alert", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("escalationLevel ASC")
    private List<EscalationChainEntry> escalationChain = new ArrayList<>();

    @OneToMany(mappedBy = "alert", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("triggerTime ASC")
    private List<EscalationTimer> escalationTimers = new ArrayList<>();

    @Column(name = "auto_escalation_enabled", nullable = false)
    private boolean autoEscalationEnabled = true;

    // Reconhecimentos
    @OneToMany(mappedBy = "alert", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("acknowledgedAt ASC")
    private List<AlertAcknowledgment> acknowledgments = new ArrayList<>();

    // Status e prioridade
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private AlertStatus status = AlertStatus.ACTIVE;

    @OneToMany(mappedBy = "alert", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("changedAt ASC")
    private List<AlertStatusChange> statusHistory = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false)
    private AlertPriority priority;

    @Column(name = "auto_escalate", nullable = false)
    private boolean autoEscalate = true;

    // Resolução
    @Embedded
    private AlertResolution resolution = new AlertResolution();

    @ElementCollection
    @CollectionTable(name = "alert_resolution_actions", joinColumns = @JoinColumn(name = "alert_pk"))
    @OrderColumn(name = "list_index")
    @Column(name = "action_taken")
    private List<String> resolutionActions = new ArrayList<>();

    // Analytics
    @Column(name = "response_rate")
    private Integer responseRate = 0;

    @Column(name = "average_response_minutes")
    private Double averageResponseMinutes;

    // Metadados
    @Column(name = "category")
    private String category;

    @ElementCollection
    @CollectionTable(name = "alert_tags", joinColumns = @JoinColumn(name = "alert_pk"))
    @Column(name = "tag")
    private Set<String> tags = new LinkedHashSet<>();

    @Column(name = "external_reference")
    private String externalReference;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    // ============================================
    // OPERAÇÕES SOBRE AS SUB-COLEÇÕES
    // ============================================

    public void addRecipient(AlertRecipient recipient) {
        recipient.setAlert(this);
        recipients.add(recipient);
    }

    public Optional<AlertRecipient> findRecipient(String userId) {
        return recipients.stream()
            .filter(r -> r.getUserId().equals(userId))
            .findFirst();
    }

    public boolean hasRecipient(String userId) {
        return findRecipient(userId).isPresent();
    }

    public void addDeliveryAttempt(DeliveryAttempt attempt) {
        attempt.setAlert(this);
        deliveryAttempts.add(attempt);
    }

    public void addEscalationRule(EscalationRule rule) {
        rule.setAlert(this);
        escalationRules.add(rule);
    }

    public void addEscalationChainEntry(EscalationChainEntry entry) {
        entry.setAlert(this);
        escalationChain.add(entry);
    }

    public void addEscalationTimer(EscalationTimer timer) {
        timer.setAlert(this);
        escalationTimers.add(timer);
    }

    public void addAcknowledgment(AlertAcknowledgment acknowledgment) {
        acknowledgment.setAlert(this);
        acknowledgments.add(acknowledgment);
    }

    public void addStatusChange(AlertStatusChange change) {
        change.setAlert(this);
        statusHistory.add(change);
    }

    /**
     * Usuários distintos que reconheceram o alerta (reconhecimentos repetidos contam uma vez)
     */
    public Set<String> getAcknowledgedUserIds() {
        return acknowledgments.stream()
            .map(AlertAcknowledgment::getUserId)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * ceil(0.5 × destinatários); constante de projeto, não configurável
     */
    public int getAcknowledgmentThreshold() {
        return (int) Math.ceil(recipients.size() * 0.5);
    }

    public boolean isClosed() {
        return status == AlertStatus.RESOLVED
            || status == AlertStatus.CANCELLED
            || status == AlertStatus.ARCHIVED;
    }

    /**
     * Fuso de entrega do alerta (validado na criação)
     */
    public ZoneId deliveryZone() {
        return ZoneId.of(timezone != null ? timezone : "Asia/Kolkata");
    }

    /**
     * Meia-noite seguinte no fuso do alerta, convertida para o fuso do sistema.
     * Horário de envio dos destinatários de resumo diário.
     */
    public LocalDateTime startOfNextLocalDay(LocalDateTime now, ZoneId systemZone) {
        ZonedDateTime localNow = now.atZone(systemZone).withZoneSameInstant(deliveryZone());
        return localNow.toLocalDate().plusDays(1).atStartOfDay(localNow.getZone())
            .withZoneSameInstant(systemZone)
            .toLocalDateTime();
    }

    /**
     * Desativa todos os timers pendentes. Retorna quantos estavam ativos.
     */
    public int deactivateTimers() {
        int deactivated = 0;
        for (EscalationTimer timer : escalationTimers) {
            if (timer.isActive()) {
                timer.setActive(false);
                deactivated++;
            }
        }
        return deactivated;
    }

    /**
     * Próximo ciclo de um alerta recorrente, ou null se não houver
     */
    public LocalDateTime getNextRecurrenceAt() {
        if (recurrenceInterval == null || lastDispatchedAt == null) {
            return null;
        }
        LocalDateTime next = recurrenceInterval.advance(lastDispatchedAt);
        if (recurrenceEndDate != null && next.isAfter(recurrenceEndDate)) {
            return null;
        }
        return next;
    }

    public int getDeliverySuccessRate() {
        int total = deliveryStatistics.getTotalRecipients();
        if (total == 0) {
            return 0;
        }
        return (int) Math.round(deliveryStatistics.getDelivered() * 100.0 / total);
    }

    /**
     * Recalcula as estatísticas agregadas a partir do estado completo
     * destinatário × canal. Chamado explicitamente ao final de toda mutação.
     */
    public void recomputeDeliveryStatistics() {
        int sent = 0;
        int delivered = 0;
        int read = 0;
        int failed = 0;

        for (AlertRecipient recipient : recipients) {
            for (RecipientDeliveryStatus status : recipient.getDeliveryStatuses()) {
                switch (status.getState()) {
                    case SENT:
                        sent++;
                        break;
                    case DELIVERED:
                        delivered++;
                        break;
                    case READ:
                        read++;
                        break;
                    case FAILED:
                        failed++;
                        break;
                    case PENDING:
                        break;
                }
            }
        }

        deliveryStatistics.setTotalRecipients(recipients.size());
        deliveryStatistics.setSent(sent);
        deliveryStatistics.setDelivered(delivered);
        deliveryStatistics.setRead(read);
        deliveryStatistics.setFailed(failed);

        recomputeResponseAnalytics();
    }

    private void recomputeResponseAnalytics() {
        if (recipients.isEmpty()) {
            responseRate = 0;
            averageResponseMinutes = null;
            return;
        }

        Set<String> acknowledgedBy = getAcknowledgedUserIds();
        responseRate = (int) Math.min(100, Math.round(acknowledgedBy.size() * 100.0 / recipients.size()));

        // Tempo até o primeiro reconhecimento de cada usuário
        List<Long> minutes = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (AlertAcknowledgment ack : acknowledgments) {
            if (seen.add(ack.getUserId()) && triggeredAt != null && ack.getAcknowledgedAt() != null) {
                minutes.add(Duration.between(triggeredAt, ack.getAcknowledgedAt()).toMinutes());
            }
        }
        averageResponseMinutes = minutes.isEmpty()
            ? null
            : minutes.stream().mapToLong(Long::longValue).average().orElse(0.0);
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getAlertId() {
        return alertId;
    }

    public void setAlertId(String alertId) {
        this.alertId = alertId;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }

    public AlertSourceKind getSourceKind() {
        return sourceKind;
    }

    public void setSourceKind(AlertSourceKind sourceKind) {
        this.sourceKind = sourceKind;
    }

    public SourceModel getSourceModel() {
        return sourceModel;
    }

    public void setSourceModel(SourceModel sourceModel) {
        this.sourceModel = sourceModel;
    }

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    public LocalDateTime getTriggeredAt() {
        return triggeredAt;
    }

    public void setTriggeredAt(LocalDateTime triggeredAt) {
        this.triggeredAt = triggeredAt;
    }

    public AlertType getAlertType() {
        return alertType;
    }

    public void setAlertType(AlertType alertType) {
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

    public AlertLevel getLevel() {
        return level;
    }

    public void setLevel(AlertLevel level) {
        this.level = level;
    }

    public Set<String> getAffectedVillages() {
        return affectedVillages;
    }

    public void setAffectedVillages(Set<String> affectedVillages) {
        this.affectedVillages = affectedVillages;
    }

    public Set<String> getAffectedBlocks() {
        return affectedBlocks;
    }

    public void setAffectedBlocks(Set<String> affectedBlocks) {
        this.affectedBlocks = affectedBlocks;
    }

    public Set<String> getAffectedDistricts() {
        return affectedDistricts;
    }

    public void setAffectedDistricts(Set<String> affectedDistricts) {
        this.affectedDistricts = affectedDistricts;
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

    public AudienceType getAudienceType() {
        return audienceType;
    }

    public void setAudienceType(AudienceType audienceType) {
        this.audienceType = audienceType;
    }

    public List<String> getTargetUsers() {
        return targetUsers;
    }

    public void setTargetUsers(List<String> targetUsers) {
        this.targetUsers = targetUsers;
    }

    public Set<UserRole> getTargetRoles() {
        return targetRoles;
    }

    public void setTargetRoles(Set<UserRole> targetRoles) {
        this.targetRoles = targetRoles;
    }

    public Integer getCriteriaMinAge() {
        return criteriaMinAge;
    }

    public void setCriteriaMinAge(Integer criteriaMinAge) {
        this.criteriaMinAge = criteriaMinAge;
    }

    public Integer getCriteriaMaxAge() {
        return criteriaMaxAge;
    }

    public void setCriteriaMaxAge(Integer criteriaMaxAge) {
        this.criteriaMaxAge = criteriaMaxAge;
    }

    public String getCriteriaGender() {
        return criteriaGender;
    }

    public void setCriteriaGender(String criteriaGender) {
        this.criteriaGender = criteriaGender;
    }

    public String getCriteriaLocation() {
        return criteriaLocation;
    }

    public void setCriteriaLocation(String criteriaLocation) {
        this.criteriaLocation = criteriaLocation;
    }

    public Set<String> getCriteriaHealthConditions() {
        return criteriaHealthConditions;
    }

    public void setCriteriaHealthConditions(Set<String> criteriaHealthConditions) {
        this.criteriaHealthConditions = criteriaHealthConditions;
    }

    public LocalDateTime getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(LocalDateTime expiresAt) {
        this.expiresAt = expiresAt;
    }

    public boolean isAutoArchive() {
        return autoArchive;
    }

    public void setAutoArchive(boolean autoArchive) {
        this.autoArchive = autoArchive;
    }

    public int getArchiveAfterDays() {
        return archiveAfterDays;
    }

    public void setArchiveAfterDays(int archiveAfterDays) {
        this.archiveAfterDays = archiveAfterDays;
    }

    public List<DeliveryChannel> getChannels() {
        return channels;
    }

    public void setChannels(List<DeliveryChannel> channels) {
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

    public RecurrenceInterval getRecurrenceInterval() {
        return recurrenceInterval;
    }

    public void setRecurrenceInterval(RecurrenceInterval recurrenceInterval) {
        this.recurrenceInterval = recurrenceInterval;
    }

    public LocalDateTime getRecurrenceEndDate() {
        return recurrenceEndDate;
    }

    public void setRecurrenceEndDate(LocalDateTime recurrenceEndDate) {
        this.recurrenceEndDate = recurrenceEndDate;
    }

    public LocalDateTime getLastDispatchedAt() {
        return lastDispatchedAt;
    }

    public void setLastDispatchedAt(LocalDateTime lastDispatchedAt) {
        this.lastDispatchedAt = lastDispatchedAt;
    }

    public DeliveryStatistics getDeliveryStatistics() {
        return deliveryStatistics;
    }

    public void setDeliveryStatistics(DeliveryStatistics deliveryStatistics) {
        this.deliveryStatistics = deliveryStatistics;
    }

    public List<AlertRecipient> getRecipients() {
        return recipients;
    }

    public void setRecipients(List<AlertRecipient> recipients) {
        this.recipients = recipients;
    }

    public List<DeliveryAttempt> getDeliveryAttempts() {
        return deliveryAttempts;
    }

    public void setDeliveryAttempts(List<DeliveryAttempt> deliveryAttempts) {
        this.deliveryAttempts = deliveryAttempts;
    }

    public List<EscalationRule> getEscalationRules() {
        return escalationRules;
    }

    public void setEscalationRules(List<EscalationRule> escalationRules) {
        this.escalationRules = escalationRules;
    }

    public List<EscalationChainEntry> getEscalationChain() {
        return escalationChain;
    }

    public void setEscalationChain(List<EscalationChainEntry> escalationChain) {
        this.escalationChain = escalationChain;
    }

    public List<EscalationTimer> getEscalationTimers() {
        return escalationTimers;
    }

    public void setEscalationTimers(List<EscalationTimer> escalationTimers) {
        this.escalationTimers = escalationTimers;
    }

    public boolean isAutoEscalationEnabled() {
        return autoEscalationEnabled;
    }

    public void setAutoEscalationEnabled(boolean autoEscalationEnabled) {
        this.autoEscalationEnabled = autoEscalationEnabled;
    }

    public List<AlertAcknowledgment> getAcknowledgments() {
        return acknowledgments;
    }

    public void setAcknowledgments(List<AlertAcknowledgment> acknowledgments) {
        this.acknowledgments = acknowledgments;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public void setStatus(AlertStatus status) {
        this.status = status;
    }

    public List<AlertStatusChange> getStatusHistory() {
        return statusHistory;
    }

    public void setStatusHistory(List<AlertStatusChange> statusHistory) {
        this.statusHistory = statusHistory;
    }

    public AlertPriority getPriority() {
        return priority;
    }

    public void setPriority(AlertPriority priority) {
        this.priority = priority;
    }

    public boolean isAutoEscalate() {
        return autoEscalate;
    }

    public void setAutoEscalate(boolean autoEscalate) {
        this.autoEscalate = autoEscalate;
    }

    public AlertResolution getResolution() {
        return resolution;
    }

    public void setResolution(AlertResolution resolution) {
        this.resolution = resolution;
    }

    public List<String> getResolutionActions() {
        return resolutionActions;
    }

    public void setResolutionActions(List<String> resolutionActions) {
        this.resolutionActions = resolutionActions;
    }

    public Integer getResponseRate() {
        return responseRate;
    }

    public void setResponseRate(Integer responseRate) {
        this.responseRate = responseRate;
    }

    public Double getAverageResponseMinutes() {
        return averageResponseMinutes;
    }

    public void setAverageResponseMinutes(Double averageResponseMinutes) {
        this.averageResponseMinutes = averageResponseMinutes;
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

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }
}
