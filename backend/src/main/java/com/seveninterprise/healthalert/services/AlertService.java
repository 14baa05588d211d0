package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.dto.AcknowledgeAlertRequest;
import com.seveninterprise.healthalert.dto.AlertSearchCriteria;
import com.seveninterprise.healthalert.dto.BulkAlertRequest;
import com.seveninterprise.healthalert.dto.BulkAlertResponse;
import com.seveninterprise.healthalert.dto.CreateAlertRequest;
import com.seveninterprise.healthalert.dto.DeliveryReceiptRequest;
import com.seveninterprise.healthalert.dto.DeliveryStatisticsResponse;
import com.seveninterprise.healthalert.dto.DeliveryTypeStatistics;
import com.seveninterprise.healthalert.dto.EscalateAlertRequest;
import com.seveninterprise.healthalert.dto.ResolveAlertRequest;
import com.seveninterprise.healthalert.dto.UpdateAlertStatusRequest;
import com.seveninterprise.healthalert.exceptions.AlertAccessDeniedException;
import com.seveninterprise.healthalert.exceptions.AlertClosedException;
import com.seveninterprise.healthalert.exceptions.AlertException;
import com.seveninterprise.healthalert.exceptions.AlertNotFoundException;
import com.seveninterprise.healthalert.exceptions.AlertValidationException;
import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.AlertAcknowledgment;
import com.seveninterprise.healthalert.model.AlertRecipient;
import com.seveninterprise.healthalert.model.AlertResolution;
import com.seveninterprise.healthalert.model.AlertStatusChange;
import com.seveninterprise.healthalert.model.EscalationChainEntry;
import com.seveninterprise.healthalert.model.EscalationRule;
import com.seveninterprise.healthalert.model.RecipientDeliveryStatus;
import com.seveninterprise.healthalert.repositories.AlertRepository;
import com.seveninterprise.healthalert.repositories.AlertStatusChangeRepository;
import org.hibernate.Hibernate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Serviço de alertas
 *
 * Ponto de entrada do motor: criação, reconhecimento, resolução, escalação
 * manual, cancelamento e leituras. Toda mutação de um alerta existente
 * passa pelo AlertLockManager; a entrega acontece depois do commit.
 */
@Service
public class AlertService implements IAlertService {

    private static final Logger LOGGER = LoggerFactory.getLogger(AlertService.class);

    static final List<Alert.DeliveryChannel> DEFAULT_CHANNELS = Arrays.asList(
        Alert.DeliveryChannel.SMS, Alert.DeliveryChannel.EMAIL, Alert.DeliveryChannel.PUSH_NOTIFICATION);

    static final int ACTIVE_ALERTS_LIMIT = 50;

    private static final Set<Alert.AlertStatus> RESOLVABLE =
        EnumSet.of(Alert.AlertStatus.ACTIVE, Alert.AlertStatus.ACKNOWLEDGED, Alert.AlertStatus.EXPIRED);
    private static final Set<Alert.AlertStatus> CANCELLABLE =
        EnumSet.of(Alert.AlertStatus.ACTIVE, Alert.AlertStatus.ACKNOWLEDGED);
    private static final Set<Alert.AlertStatus> OPEN =
        EnumSet.of(Alert.AlertStatus.ACTIVE, Alert.AlertStatus.ACKNOWLEDGED);

    private final AlertRepository alertRepository;
    private final AlertStatusChangeRepository statusChangeRepository;
    private final AlertIdGenerator idGenerator;
    private final AlertLockManager lockManager;
    private final IRecipientResolver recipientResolver;
    private final IEscalationService escalationService;
    private final IDeliveryDispatcher dispatcher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public AlertService(AlertRepository alertRepository,
                        AlertStatusChangeRepository statusChangeRepository,
                        AlertIdGenerator idGenerator,
                        AlertLockManager lockManager,
                        IRecipientResolver recipientResolver,
                        IEscalationService escalationService,
                        IDeliveryDispatcher dispatcher,
                        TransactionTemplate transactionTemplate,
                        Clock clock) {
        this.alertRepository = alertRepository;
        this.statusChangeRepository = statusChangeRepository;
        this.idGenerator = idGenerator;
        this.lockManager = lockManager;
        this.recipientResolver = recipientResolver;
        this.escalationService = escalationService;
        this.dispatcher = dispatcher;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    // ============================================
    // CRIAÇÃO
    // ============================================

    @Override
    public Alert createAlert(CreateAlertRequest request, String createdBy) {
        LocalDateTime now = LocalDateTime.now(clock);
        validate(request, now);

        Alert alert = transactionTemplate.execute(status -> {
            Alert created = buildAlert(request, createdBy, now);
            created.setAlertId(idGenerator.nextAlertId());

            for (AlertRecipient recipient : recipientResolver.resolveRecipients(created, now)) {
                created.addRecipient(recipient);
            }
            dispatcher.queueDeliveries(created, now);

            if (request.getEscalationRules() != null) {
                for (CreateAlertRequest.EscalationRuleRequest ruleRequest : request.getEscalationRules()) {
                    created.addEscalationRule(new EscalationRule(
                        ruleRequest.getCondition(),
                        ruleRequest.getThreshold(),
                        ruleRequest.getAction(),
                        ruleRequest.getEscalateTo() != null ? new ArrayList<>(ruleRequest.getEscalateTo()) : new ArrayList<>()));
                }
            }
            escalationService.registerTimers(created, now);
            escalationService.evaluateSeverityRules(created, now);

            created.addStatusChange(new AlertStatusChange(null, Alert.AlertStatus.ACTIVE, createdBy, now, "Alerta criado"));
            created.recomputeDeliveryStatistics();
            return alertRepository.save(created);
        });

        LOGGER.info("🚨 [ALERT] Alerta {} criado ({} / {}) com {} destinatário(s)",
                    alert.getAlertId(), alert.getAlertType(), alert.getLevel(), alert.getRecipients().size());

        if (alert.getScheduledFor() == null || !alert.getScheduledFor().isAfter(now)) {
            dispatcher.dispatchAsync(alert.getAlertId());
        }
        return alert;
    }

    @Override
    public BulkAlertResponse createAlerts(BulkAlertRequest request, String createdBy) {
        if (request == null || request.getAlerts() == null || request.getAlerts().isEmpty()) {
            throw new AlertValidationException("Lista de alertas vazia");
        }

        BulkAlertResponse response = new BulkAlertResponse();
        List<CreateAlertRequest> alerts = request.getAlerts();
        for (int i = 0; i < alerts.size(); i++) {
            try {
                Alert alert = createAlert(alerts.get(i), createdBy);
                response.addSuccess(i, alert.getAlertId());
            } catch (AlertException e) {
                response.addFailure(i, e.getMessage());
                if (request.isStopOnFirstFailure()) {
                    break;
                }
            } catch (RuntimeException e) {
                LOGGER.error("❌ [ALERT] Erro ao criar alerta {} do lote: {}", i, e.getMessage(), e);
                response.addFailure(i, "Erro interno ao criar alerta");
                if (request.isStopOnFirstFailure()) {
                    break;
                }
            }
        }

        LOGGER.info("📦 [ALERT] Lote processado: {} criado(s), {} falha(s)",
                    response.getSuccessCount(), response.getFailureCount());
        return response;
    }

    // ============================================
    // MUTAÇÕES SOB LOCK
    // ============================================

    @Override
    public Alert acknowledge(String alertId, String userId, AcknowledgeAlertRequest request) {
        AcknowledgeAlertRequest ackRequest = request != null ? request : new AcknowledgeAlertRequest();

        return lockManager.executeInLock(alertId, () -> {
            Alert alert = loadAlert(alertId);
            if (alert.isClosed()) {
                throw new AlertClosedException(alertId, alert.getStatus(), "acknowledge");
            }
            if (!alert.hasRecipient(userId)) {
                throw new AlertAccessDeniedException("Usuário " + userId + " não é destinatário do alerta " + alertId);
            }

            LocalDateTime now = LocalDateTime.now(clock);
            AlertAcknowledgment acknowledgment = new AlertAcknowledgment(userId, now);
            if (ackRequest.getActions() != null) {
                acknowledgment.setActions(new ArrayList<>(ackRequest.getActions()));
            }
            acknowledgment.setComments(ackRequest.getComments());
            acknowledgment.setLatitude(ackRequest.getLatitude());
            acknowledgment.setLongitude(ackRequest.getLongitude());
            alert.addAcknowledgment(acknowledgment);
            alert.recomputeDeliveryStatistics();

            // Limiar lido no mesmo snapshot travado em que o reconhecimento foi anexado
            int acknowledged = alert.getAcknowledgedUserIds().size();
            if (alert.getStatus() == Alert.AlertStatus.ACTIVE && acknowledged >= alert.getAcknowledgmentThreshold()) {
                changeStatus(alert, Alert.AlertStatus.ACKNOWLEDGED, userId, now,
                    "Limiar de reconhecimento atingido (" + acknowledged + "/" + alert.getRecipients().size() + ")");
                LOGGER.info("✅ [ALERT] Alerta {} reconhecido por {} de {} destinatário(s)",
                            alertId, acknowledged, alert.getRecipients().size());
            }

            alert.setUpdatedAt(now);
            return initialize(alertRepository.save(alert));
        });
    }

    @Override
    public Alert resolve(String alertId, String resolvedBy, ResolveAlertRequest request) {
        ResolveAlertRequest resolveRequest = request != null ? request : new ResolveAlertRequest();

        return lockManager.executeInLock(alertId, () -> {
            Alert alert = loadAlert(alertId);
            if (!RESOLVABLE.contains(alert.getStatus())) {
                throw new AlertClosedException(alertId, alert.getStatus(), "resolve");
            }

            LocalDateTime now = LocalDateTime.now(clock);
            AlertResolution resolution = alert.getResolution();
            resolution.setStatus(AlertResolution.ResolutionStatus.RESOLVED);
            resolution.setResolvedBy(resolvedBy);
            resolution.setResolvedAt(now);
            resolution.setComments(resolveRequest.getComments());
            resolution.setResolutionType(resolveRequest.getResolutionType() != null
                ? resolveRequest.getResolutionType()
                : AlertResolution.ResolutionType.MANUAL_INTERVENTION);
            resolution.setFollowUpRequired(resolveRequest.isFollowUpRequired());
            if (resolveRequest.getActionsTaken() != null) {
                alert.getResolutionActions().addAll(resolveRequest.getActionsTaken());
            }

            int deactivated = alert.deactivateTimers();
            changeStatus(alert, Alert.AlertStatus.RESOLVED, resolvedBy, now, resolveRequest.getComments());
            alert.setUpdatedAt(now);

            LOGGER.info("✅ [ALERT] Alerta {} resolvido por {} ({} timer(s) desativado(s))", alertId, resolvedBy, deactivated);
            return initialize(alertRepository.save(alert));
        });
    }

    @Override
    public Alert escalate(String alertId, String escalatedBy, EscalateAlertRequest request) {
        if (request == null) {
            throw new AlertValidationException("Pedido de escalação é obrigatório");
        }

        Alert escalated = lockManager.executeInLock(alertId, () -> {
            Alert alert = loadAlert(alertId);
            LocalDateTime now = LocalDateTime.now(clock);
            escalationService.escalate(alert, EscalationRule.EscalationAction.ESCALATE_TO_SUPERVISOR,
                request.getEscalateTo(), escalatedBy,
                request.getReason() != null ? request.getReason() : "Escalação manual", now);
            return initialize(alertRepository.save(alert));
        });

        dispatcher.dispatchAsync(alertId);
        return escalated;
    }

    @Override
    public Alert cancel(String alertId, String cancelledBy, String reason) {
        return lockManager.executeInLock(alertId, () -> {
            Alert alert = loadAlert(alertId);
            if (!CANCELLABLE.contains(alert.getStatus())) {
                throw new AlertClosedException(alertId, alert.getStatus(), "cancel");
            }

            LocalDateTime now = LocalDateTime.now(clock);
            alert.deactivateTimers();
            changeStatus(alert, Alert.AlertStatus.CANCELLED, cancelledBy, now, reason);
            alert.setUpdatedAt(now);

            LOGGER.info("🛑 [ALERT] Alerta {} cancelado por {}", alertId, cancelledBy);
            return initialize(alertRepository.save(alert));
        });
    }

    @Override
    public Alert updateStatus(String alertId, String changedBy, UpdateAlertStatusRequest request) {
        if (request == null || request.getStatus() == null) {
            throw new AlertValidationException("Novo status é obrigatório");
        }

        switch (request.getStatus()) {
            case RESOLVED:
                ResolveAlertRequest resolveRequest = new ResolveAlertRequest(
                    request.getReason(), AlertResolution.ResolutionType.MANUAL_INTERVENTION);
                return resolve(alertId, changedBy, resolveRequest);

            case CANCELLED:
                return cancel(alertId, changedBy, request.getReason());

            case EXPIRED:
                return lockManager.executeInLock(alertId, () -> {
                    Alert alert = loadAlert(alertId);
                    if (!OPEN.contains(alert.getStatus())) {
                        throw new AlertClosedException(alertId, alert.getStatus(), "expire");
                    }
                    LocalDateTime now = LocalDateTime.now(clock);
                    alert.deactivateTimers();
                    changeStatus(alert, Alert.AlertStatus.EXPIRED, changedBy, now, request.getReason());
                    alert.setUpdatedAt(now);
                    LOGGER.info("⌛ [ALERT] Alerta {} marcado como expirado por {}", alertId, changedBy);
                    return initialize(alertRepository.save(alert));
                });

            default:
                // ACKNOWLEDGED só pelo limiar, ARCHIVED só pela varredura, ACTIVE nunca volta
                Alert current = alertRepository.findByAlertId(alertId)
                    .orElseThrow(() -> new AlertNotFoundException(alertId));
                throw new AlertClosedException(alertId, current.getStatus(), "set status " + request.getStatus());
        }
    }

    @Override
    public Alert recordDeliveryReceipt(String alertId, DeliveryReceiptRequest request) {
        if (request == null || request.getUserId() == null || request.getChannel() == null || request.getState() == null) {
            throw new AlertValidationException("Recibo de entrega requer userId, channel e state");
        }
        if (request.getState() == RecipientDeliveryStatus.DeliveryState.PENDING) {
            throw new AlertValidationException("Recibo de entrega não pode voltar a PENDING");
        }

        return lockManager.executeInLock(alertId, () -> {
            Alert alert = loadAlert(alertId);
            AlertRecipient recipient = alert.findRecipient(request.getUserId())
                .orElseThrow(() -> new AlertValidationException(
                    "Usuário " + request.getUserId() + " não é destinatário do alerta " + alertId));

            LocalDateTime now = LocalDateTime.now(clock);
            RecipientDeliveryStatus status = recipient.deliveryStatusFor(request.getChannel(), now);
            status.setState(request.getState());
            status.setStatusAt(now);
            status.setErrorMessage(request.getState() == RecipientDeliveryStatus.DeliveryState.FAILED
                ? request.getErrorMessage()
                : null);
            status.setClaimedAt(null);
            status.setHeldUntil(null);

            alert.recomputeDeliveryStatistics();
            alert.setUpdatedAt(now);
            return initialize(alertRepository.save(alert));
        });
    }

    // ============================================
    // LEITURAS
    // ============================================

    @Override
    @Transactional(readOnly = true)
    public Alert getAlert(String alertId) {
        return initialize(loadAlert(alertId));
    }

    @Override
    @Transactional(readOnly = true)
    public DeliveryStatisticsResponse getDeliveryStatistics(String alertId) {
        return DeliveryStatisticsResponse.from(loadAlert(alertId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<EscalationChainEntry> getEscalationChain(String alertId) {
        Alert alert = loadAlert(alertId);
        alert.getEscalationChain().forEach(entry -> Hibernate.initialize(entry.getRecipients()));
        return new ArrayList<>(alert.getEscalationChain());
    }

    @Override
    @Transactional(readOnly = true)
    public List<AlertStatusChange> getStatusHistory(String alertId) {
        if (!alertRepository.existsByAlertId(alertId)) {
            throw new AlertNotFoundException(alertId);
        }
        return statusChangeRepository.findByAlertAlertIdOrderByChangedAtAsc(alertId);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<Alert> listAlerts(AlertSearchCriteria criteria, Pageable pageable) {
        AlertSearchCriteria filter = criteria != null ? criteria : new AlertSearchCriteria();
        Page<Alert> page = alertRepository.search(
            filter.getStatus(), filter.getAlertType(), filter.getLevel(), filter.getPriority(),
            filter.getVillageId(), filter.getBlockId(), filter.getDistrictId(),
            filter.getCreatedFrom(), filter.getCreatedTo(), pageable);
        page.getContent().forEach(this::initialize);
        return page;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Alert> getActiveAlertsForUser(String userId) {
        LocalDateTime now = LocalDateTime.now(clock);
        return alertRepository.findActiveForRecipient(userId, Alert.AlertStatus.ACTIVE, now).stream()
            .sorted(Comparator.comparing((Alert a) -> a.getPriority().ordinal()).reversed()
                .thenComparing(Alert::getCreatedAt, Comparator.reverseOrder()))
            .limit(ACTIVE_ALERTS_LIMIT)
            .map(this::initialize)
            .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<Alert> getAlertsByTypeAndArea(Alert.AlertType alertType, String villageId, String blockId, String districtId) {
        if (alertType == null) {
            throw new AlertValidationException("Tipo de alerta é obrigatório");
        }
        if (villageId == null && blockId == null && districtId == null) {
            throw new AlertValidationException("Informe ao menos uma área (vila, bloco ou distrito)");
        }
        return alertRepository.findByTypeAndArea(alertType, OPEN, villageId, blockId, districtId).stream()
            .map(this::initialize)
            .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<DeliveryTypeStatistics> getDeliveryStatisticsByType(int days) {
        if (days < 1) {
            throw new AlertValidationException("Período deve ser de pelo menos 1 dia");
        }
        LocalDateTime since = LocalDateTime.now(clock).minusDays(days);

        List<DeliveryTypeStatistics> statistics = new ArrayList<>();
        for (Object[] row : alertRepository.aggregateDeliveryByType(since)) {
            statistics.add(new DeliveryTypeStatistics(
                (Alert.AlertType) row[0],
                toLong(row[1]),
                toLong(row[2]),
                toLong(row[3]),
                toLong(row[4]),
                toLong(row[5]),
                toLong(row[6]),
                row[7] != null ? ((Number) row[7]).doubleValue() : null));
        }
        statistics.sort(Comparator.comparing(DeliveryTypeStatistics::getTotalAlerts).reversed());
        return statistics;
    }

    // ============================================
    // AUXILIARES
    // ============================================

    private Alert loadAlert(String alertId) {
        return alertRepository.findByAlertId(alertId)
            .orElseThrow(() -> new AlertNotFoundException(alertId));
    }

    private void changeStatus(Alert alert, Alert.AlertStatus to, String changedBy, LocalDateTime now, String reason) {
        alert.addStatusChange(new AlertStatusChange(alert.getStatus(), to, changedBy, now, reason));
        alert.setStatus(to);
    }

    private void validate(CreateAlertRequest request, LocalDateTime now) {
        if (request == null) {
            throw new AlertValidationException("Pedido de criação é obrigatório");
        }
        if (request.getTitle() == null || request.getTitle().isBlank()) {
            throw new AlertValidationException("Título é obrigatório");
        }
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            throw new AlertValidationException("Mensagem é obrigatória");
        }
        if (request.getAlertType() == null || request.getLevel() == null) {
            throw new AlertValidationException("Tipo e nível do alerta são obrigatórios");
        }
        if (request.getTargetAudience() == null || request.getTargetAudience().getType() == null) {
            throw new AlertValidationException("Público-alvo é obrigatório");
        }

        CreateAlertRequest.ExpirationConfig expiration = request.getExpiration();
        if (expiration != null && expiration.getExpiresAt() != null && expiration.getExpiresAt().isBefore(now)) {
            throw new AlertValidationException("expiresAt não pode ser anterior à criação do alerta");
        }
        if (expiration != null && expiration.getArchiveAfterDays() != null && expiration.getArchiveAfterDays() < 1) {
            throw new AlertValidationException("archiveAfterDays deve ser pelo menos 1");
        }

        if (request.getEscalationRules() != null) {
            for (CreateAlertRequest.EscalationRuleRequest rule : request.getEscalationRules()) {
                if (rule == null || rule.getAction() == null) {
                    throw new AlertValidationException("Regra de escalação com ação ausente ou desconhecida");
                }
                if (rule.getCondition() == null) {
                    throw new AlertValidationException("Regra de escalação com condição ausente ou desconhecida");
                }
                if (rule.getThreshold() != null && rule.getThreshold() < 0) {
                    throw new AlertValidationException("Limiar de escalação não pode ser negativo");
                }
            }
        }

        CreateAlertRequest.DeliveryConfig delivery = request.getDelivery();
        if (delivery != null && delivery.getTimezone() != null) {
            try {
                ZoneId.of(delivery.getTimezone());
            } catch (DateTimeException e) {
                throw new AlertValidationException("Fuso horário inválido: " + delivery.getTimezone());
            }
        }
    }

    private Alert buildAlert(CreateAlertRequest request, String createdBy, LocalDateTime now) {
        Alert alert = new Alert();

        alert.setSourceKind(request.getSourceKind() != null ? request.getSourceKind() : Alert.AlertSourceKind.USER);
        alert.setSourceModel(request.getSourceModel());
        alert.setSourceId(request.getSourceId() != null ? request.getSourceId() : createdBy);
        alert.setTriggeredAt(now);

        alert.setAlertType(request.getAlertType());
        alert.setTitle(request.getTitle().trim());
        alert.setMessage(request.getMessage().trim());
        alert.setLevel(request.getLevel());
        alert.setPriority(request.getPriority() != null ? request.getPriority() : request.getLevel().defaultPriority());

        CreateAlertRequest.AffectedAreas areas = request.getAffectedAreas();
        if (areas != null) {
            alert.setAffectedVillages(copy(areas.getVillages()));
            alert.setAffectedBlocks(copy(areas.getBlocks()));
            alert.setAffectedDistricts(copy(areas.getDistricts()));
            alert.setCenterLatitude(areas.getCenterLatitude());
            alert.setCenterLongitude(areas.getCenterLongitude());
            alert.setRadiusKm(areas.getRadiusKm());
        }

        CreateAlertRequest.TargetAudience audience = request.getTargetAudience();
        alert.setAudienceType(audience.getType());
        if (audience.getUserIds() != null) {
            alert.setTargetUsers(new ArrayList<>(audience.getUserIds()));
        }
        if (audience.getRoles() != null) {
            alert.setTargetRoles(new LinkedHashSet<>(audience.getRoles()));
        }
        alert.setCriteriaMinAge(audience.getMinAge());
        alert.setCriteriaMaxAge(audience.getMaxAge());
        alert.setCriteriaGender(audience.getGender());
        alert.setCriteriaLocation(audience.getLocation());
        alert.setCriteriaHealthConditions(copy(audience.getHealthConditions()));

        CreateAlertRequest.DeliveryConfig delivery = request.getDelivery();
        List<Alert.DeliveryChannel> channels = delivery != null && delivery.getChannels() != null && !delivery.getChannels().isEmpty()
            ? new ArrayList<>(new LinkedHashSet<>(delivery.getChannels()))
            : new ArrayList<>(DEFAULT_CHANNELS);
        alert.setChannels(channels);
        if (delivery != null) {
            alert.setScheduledFor(delivery.getScheduledFor());
            if (delivery.getTimezone() != null) {
                alert.setTimezone(delivery.getTimezone());
            }
            alert.setRecurrenceInterval(delivery.getRecurrenceInterval());
            alert.setRecurrenceEndDate(delivery.getRecurrenceEndDate());
        }

        CreateAlertRequest.ExpirationConfig expiration = request.getExpiration();
        if (expiration != null) {
            if (expiration.getAutoArchive() != null) {
                alert.setAutoArchive(expiration.getAutoArchive());
            }
            if (expiration.getArchiveAfterDays() != null) {
                alert.setArchiveAfterDays(expiration.getArchiveAfterDays());
            }
            alert.setExpiresAt(expiration.getExpiresAt());
        }
        if (alert.getExpiresAt() == null && alert.isAutoArchive()) {
            alert.setExpiresAt(now.plusDays(alert.getArchiveAfterDays()));
        }

        if (request.getAutoEscalationEnabled() != null) {
            alert.setAutoEscalationEnabled(request.getAutoEscalationEnabled());
        }
        if (request.getAutoEscalate() != null) {
            alert.setAutoEscalate(request.getAutoEscalate());
        }

        alert.setCategory(request.getCategory());
        alert.setTags(copy(request.getTags()));
        alert.setExternalReference(request.getExternalReference());

        alert.setStatus(Alert.AlertStatus.ACTIVE);
        alert.setCreatedBy(createdBy);
        alert.setCreatedAt(now);
        alert.setUpdatedAt(now);
        return alert;
    }

    /**
     * Carrega as coleções lazy para que o alerta possa ser lido fora da transação
     */
    private Alert initialize(Alert alert) {
        Hibernate.initialize(alert.getAffectedVillages());
        Hibernate.initialize(alert.getAffectedBlocks());
        Hibernate.initialize(alert.getAffectedDistricts());
        Hibernate.initialize(alert.getTargetUsers());
        Hibernate.initialize(alert.getTargetRoles());
        Hibernate.initialize(alert.getCriteriaHealthConditions());
        Hibernate.initialize(alert.getChannels());
        Hibernate.initialize(alert.getTags());
        Hibernate.initialize(alert.getResolutionActions());
        for (AlertRecipient recipient : alert.getRecipients()) {
            Hibernate.initialize(recipient.getChannels());
            Hibernate.initialize(recipient.getDeliveryStatuses());
        }
        alert.getDeliveryAttempts().forEach(attempt -> Hibernate.initialize(attempt.getErrors()));
        alert.getEscalationRules().forEach(rule -> Hibernate.initialize(rule.getEscalateTo()));
        alert.getEscalationChain().forEach(entry -> Hibernate.initialize(entry.getRecipients()));
        Hibernate.initialize(alert.getEscalationTimers());
        alert.getAcknowledgments().forEach(ack -> Hibernate.initialize(ack.getActions()));
        Hibernate.initialize(alert.getStatusHistory());
        return alert;
    }

    private static Set<String> copy(Set<String> values) {
        return values != null ? new LinkedHashSet<>(values) : new LinkedHashSet<>();
    }

    private static long toLong(Object value) {
        return value != null ? ((Number) value).longValue() : 0L;
    }
}
