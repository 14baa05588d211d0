package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.exceptions.AlertClosedException;
import com.seveninterprise.healthalert.exceptions.AlertValidationException;
import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.AlertRecipient;
import com.seveninterprise.healthalert.model.EscalationChainEntry;
import com.seveninterprise.healthalert.model.EscalationRule;
import com.seveninterprise.healthalert.model.EscalationTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ações de escalação
 *
 * Toda escalação acrescenta uma entrada à cadeia (nível = tamanho + 1) com
 * os usuários efetivamente adicionados, cria as entregas pendentes (retidas
 * até a meia-noite local para resumo diário) e nunca altera o status do
 * alerta. A prioridade só sobe, limitada a EMERGENCY.
 */
@Service
public class EscalationService implements IEscalationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(EscalationService.class);

    static final String SYSTEM_ACTOR = "system";

    /** Canais dos destinatários adicionados por escalação */
    static final List<Alert.DeliveryChannel> ESCALATION_CHANNELS = Collections.unmodifiableList(Arrays.asList(
        Alert.DeliveryChannel.SMS, Alert.DeliveryChannel.EMAIL, Alert.DeliveryChannel.PUSH_NOTIFICATION));

    /** Canais acrescentados por CHANGE_DELIVERY_METHOD */
    static final List<Alert.DeliveryChannel> URGENT_CHANNELS = Collections.unmodifiableList(Arrays.asList(
        Alert.DeliveryChannel.SMS, Alert.DeliveryChannel.VOICE_CALL));

    private final IRecipientResolver recipientResolver;
    private final IUserDirectory userDirectory;
    private final Clock clock;

    public EscalationService(IRecipientResolver recipientResolver, IUserDirectory userDirectory, Clock clock) {
        this.recipientResolver = recipientResolver;
        this.userDirectory = userDirectory;
        this.clock = clock;
    }

    @Override
    public void registerTimers(Alert alert, LocalDateTime now) {
        if (!alert.isAutoEscalationEnabled()) {
            return;
        }

        alert.addEscalationTimer(new EscalationTimer(
            EscalationTimer.INITIAL_ESCALATION,
            now,
            now.plusMinutes(alert.getLevel().getEscalationDelayMinutes()),
            EscalationRule.EscalationAction.ESCALATE_TO_SUPERVISOR));

        int index = 0;
        for (EscalationRule rule : alert.getEscalationRules()) {
            index++;
            if (rule.getCondition() == EscalationRule.EscalationCondition.TIME_BASED
                    && rule.getThreshold() != null && rule.getThreshold() > 0) {
                alert.addEscalationTimer(new EscalationTimer(
                    "rule_" + index + "_time_based",
                    now,
                    now.plusHours(rule.getThreshold()),
                    rule.getAction()));
            }
        }
    }

    @Override
    public List<EscalationChainEntry> evaluateSeverityRules(Alert alert, LocalDateTime now) {
        List<EscalationChainEntry> entries = new ArrayList<>();
        for (EscalationRule rule : alert.getEscalationRules()) {
            if (rule.getCondition() != EscalationRule.EscalationCondition.SEVERITY_BASED
                    || rule.isFired() || rule.getThreshold() == null) {
                continue;
            }
            if (alert.getLevel().ordinal() >= rule.getThreshold()) {
                rule.setFired(true);
                entries.add(escalate(alert, rule.getAction(), rule.getEscalateTo(), SYSTEM_ACTOR,
                    "Nível " + alert.getLevel() + " atingiu o limiar de severidade " + rule.getThreshold(), now));
            }
        }
        return entries;
    }

    @Override
    public List<EscalationChainEntry> evaluateDeliveryFailureRules(Alert alert, int attempted, int failed, LocalDateTime now) {
        List<EscalationChainEntry> entries = new ArrayList<>();
        if (attempted <= 0 || failed <= 0 || alert.isClosed()) {
            return entries;
        }

        int failurePercentage = (int) Math.round(failed * 100.0 / attempted);
        for (EscalationRule rule : alert.getEscalationRules()) {
            if (rule.getCondition() != EscalationRule.EscalationCondition.DELIVERY_FAILURE
                    || rule.isFired() || rule.getThreshold() == null) {
                continue;
            }
            if (failurePercentage >= rule.getThreshold()) {
                rule.setFired(true);
                entries.add(escalate(alert, rule.getAction(), rule.getEscalateTo(), SYSTEM_ACTOR,
                    failurePercentage + "% de falhas na entrega (" + failed + "/" + attempted + ")", now));
            }
        }
        return entries;
    }

    @Override
    public EscalationChainEntry fireTimer(Alert alert, EscalationTimer timer, LocalDateTime now) {
        List<String> targets = resolveTimerTargets(alert, timer.getAction());
        long waitedMinutes = Duration.between(timer.getStartTime(), now).toMinutes();
        String reason = "Sem reconhecimento após " + waitedMinutes + " minutos (timer " + timer.getName() + ")";

        LOGGER.info("⏰ [ESCALATION] Timer {} do alerta {} disparou: {} para {}",
                    timer.getName(), alert.getAlertId(), timer.getAction(), targets);

        return escalate(alert, timer.getAction(), targets, SYSTEM_ACTOR, reason, now);
    }

    @Override
    public EscalationChainEntry escalate(Alert alert, EscalationRule.EscalationAction action, List<String> escalateTo,
                                         String escalatedBy, String reason, LocalDateTime now) {
        if (action == null) {
            throw new AlertValidationException("Ação de escalação é obrigatória");
        }
        if (alert.isClosed()) {
            throw new AlertClosedException(alert.getAlertId(), alert.getStatus(), "escalate");
        }

        List<String> targets = escalateTo == null
            ? new ArrayList<>()
            : new ArrayList<>(new LinkedHashSet<>(escalateTo));
        int level = alert.getEscalationChain().size() + 1;
        LocalDateTime dailySummaryAt = alert.startOfNextLocalDay(now, clock.getZone());
        List<String> added;

        switch (action) {
            case ESCALATE_TO_SUPERVISOR:
                added = addRecipients(alert, targets, ESCALATION_CHANNELS, level, now, dailySummaryAt);
                alert.setPriority(alert.getPriority().next());
                break;

            case INCREASE_ALERT_LEVEL:
                added = addRecipients(alert, targets, ESCALATION_CHANNELS, level, now, dailySummaryAt);
                alert.setLevel(alert.getLevel().next());
                alert.setPriority(alert.getPriority().next());
                break;

            case ADD_RECIPIENTS:
                added = addRecipients(alert, targets, ESCALATION_CHANNELS, level, now, dailySummaryAt);
                break;

            case CHANGE_DELIVERY_METHOD:
                switchToUrgentChannels(alert, now, dailySummaryAt);
                added = addRecipients(alert, targets, alert.getChannels(), level, now, dailySummaryAt);
                break;

            default:
                throw new AlertValidationException("Ação de escalação desconhecida: " + action);
        }

        EscalationChainEntry entry = new EscalationChainEntry(level, added, now, escalatedBy, reason, action);
        alert.addEscalationChainEntry(entry);
        alert.setUpdatedAt(now);
        alert.recomputeDeliveryStatistics();

        LOGGER.info("📈 [ESCALATION] Alerta {} escalado para nível {} ({}), prioridade {}",
                    alert.getAlertId(), level, action, alert.getPriority());
        return entry;
    }

    /**
     * Alvos de um timer: regras TIME_BASED com a mesma ação, mais regras
     * ACKNOWLEDGMENT_BASED cujo limiar ainda não foi atingido; sem alvos
     * configurados, os supervisores dos destinatários atuais.
     */
    List<String> resolveTimerTargets(Alert alert, EscalationRule.EscalationAction action) {
        Set<String> targets = new LinkedHashSet<>();
        int responseRate = alert.getResponseRate() != null ? alert.getResponseRate() : 0;

        for (EscalationRule rule : alert.getEscalationRules()) {
            if (rule.getCondition() == EscalationRule.EscalationCondition.TIME_BASED && rule.getAction() == action) {
                targets.addAll(rule.getEscalateTo());
            } else if (rule.getCondition() == EscalationRule.EscalationCondition.ACKNOWLEDGMENT_BASED
                    && rule.getThreshold() != null && rule.getThreshold() > responseRate) {
                targets.addAll(rule.getEscalateTo());
            }
        }

        if (targets.isEmpty()) {
            List<String> currentRecipients = alert.getRecipients().stream()
                .map(AlertRecipient::getUserId)
                .collect(Collectors.toList());
            targets.addAll(userDirectory.findSupervisorIds(currentRecipients));
        }
        return new ArrayList<>(targets);
    }

    /**
     * Adiciona os alvos que ainda não são destinatários. Retorna os ids adicionados.
     */
    private List<String> addRecipients(Alert alert, List<String> userIds, List<Alert.DeliveryChannel> channels,
                                       int level, LocalDateTime now, LocalDateTime dailySummaryAt) {
        List<String> added = new ArrayList<>();
        for (AlertRecipient recipient : recipientResolver.resolveEscalationTargets(alert, userIds, channels, level, now)) {
            alert.addRecipient(recipient);
            recipient.queueDeliveries(now, dailySummaryAt);
            added.add(recipient.getUserId());
        }
        return added;
    }

    private void switchToUrgentChannels(Alert alert, LocalDateTime now, LocalDateTime dailySummaryAt) {
        for (Alert.DeliveryChannel channel : URGENT_CHANNELS) {
            if (!alert.getChannels().contains(channel)) {
                alert.getChannels().add(channel);
            }
        }

        Set<String> acknowledged = alert.getAcknowledgedUserIds();
        for (AlertRecipient recipient : alert.getRecipients()) {
            if (acknowledged.contains(recipient.getUserId())) {
                continue;
            }
            for (Alert.DeliveryChannel channel : URGENT_CHANNELS) {
                recipient.addChannel(channel);
            }
            recipient.queueDeliveries(now, dailySummaryAt);
        }
    }
}
