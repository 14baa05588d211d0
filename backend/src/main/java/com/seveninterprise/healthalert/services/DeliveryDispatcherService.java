package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.exceptions.AlertNotFoundException;
import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.AlertRecipient;
import com.seveninterprise.healthalert.model.DeliveryAttempt;
import com.seveninterprise.healthalert.model.DirectoryUser;
import com.seveninterprise.healthalert.model.EscalationChainEntry;
import com.seveninterprise.healthalert.model.RecipientDeliveryStatus;
import com.seveninterprise.healthalert.repositories.AlertRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dispatcher de entregas
 *
 * Cada lote passa por três fases:
 * 1. Reivindicação (sob lock): marca claimedAt nos pares prontos, retém
 *    pares em janela de não perturbe até o fim da janela (exceto prioridade
 *    EMERGENCY) e renderiza a mensagem de cada par
 * 2. Envio (fora do lock): uma tarefa por destinatário × canal no pool de
 *    envios, cada uma com timeout próprio; timeout vira FAILED
 * 3. Registro (sob lock): sobrescreve o status de cada par, acrescenta uma
 *    tentativa por canal e recalcula os agregados a partir do estado completo
 *
 * Falha de um par nunca impede os demais. Não há nova tentativa em linha.
 */
@Service
public class DeliveryDispatcherService implements IDeliveryDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeliveryDispatcherService.class);
    private static final ZoneId DEFAULT_ZONE = ZoneId.of("Asia/Kolkata");

    private final AlertRepository alertRepository;
    private final AlertLockManager lockManager;
    private final IChannelSender channelSender;
    private final INotificationTemplateService templateService;
    private final IUserDirectory userDirectory;
    private final IEscalationService escalationService;
    private final Clock clock;

    private ExecutorService dispatchExecutor;
    private ExecutorService sendExecutor;

    @Value("${healthalert.delivery.send.timeout:10}")
    private int sendTimeoutSeconds;

    @Value("${healthalert.delivery.max.concurrent.sends:8}")
    private int maxConcurrentSends;

    @Value("${healthalert.delivery.dispatch.threads:2}")
    private int dispatchThreads;

    public DeliveryDispatcherService(AlertRepository alertRepository,
                                     AlertLockManager lockManager,
                                     IChannelSender channelSender,
                                     INotificationTemplateService templateService,
                                     IUserDirectory userDirectory,
                                     IEscalationService escalationService,
                                     Clock clock) {
        this.alertRepository = alertRepository;
        this.lockManager = lockManager;
        this.channelSender = channelSender;
        this.templateService = templateService;
        this.userDirectory = userDirectory;
        this.escalationService = escalationService;
        this.clock = clock;
        // Executors inicializados no @PostConstruct, após a injeção dos @Value
    }

    @PostConstruct
    public void init() {
        this.dispatchExecutor = Executors.newFixedThreadPool(Math.max(1, dispatchThreads));
        this.sendExecutor = Executors.newFixedThreadPool(Math.max(1, maxConcurrentSends));
    }

    @PreDestroy
    public void shutdown() {
        dispatchExecutor.shutdown();
        sendExecutor.shutdown();
    }

    @Override
    public void queueDeliveries(Alert alert, LocalDateTime now) {
        LocalDateTime dailySummaryAt = startOfNextDay(alert, now);
        for (AlertRecipient recipient : alert.getRecipients()) {
            recipient.queueDeliveries(now, dailySummaryAt);
        }
    }

    @Override
    public void dispatchAsync(String alertId) {
        dispatchExecutor.submit(() -> {
            try {
                dispatch(alertId, false);
            } catch (RuntimeException e) {
                // Pares continuam PENDING e a varredura de entrega tenta de novo
                LOGGER.error("❌ [DELIVERY] Falha na entrega assíncrona do alerta {}: {}", alertId, e.getMessage(), e);
            }
        });
    }

    @Override
    public DispatchSummary dispatch(String alertId, boolean includeBatched) {
        ClaimedBatch batch = lockManager.executeInLock(alertId, () -> claim(alertId, includeBatched));
        if (batch.tasks.isEmpty()) {
            DispatchSummary summary = DispatchSummary.empty(alertId);
            for (int i = 0; i < batch.held; i++) {
                summary.recordHeld();
            }
            return summary;
        }

        List<SendOutcome> outcomes = send(batch);

        DispatchSummary summary = lockManager.executeInLock(alertId, () -> record(alertId, outcomes));
        for (int i = 0; i < batch.held; i++) {
            summary.recordHeld();
        }

        LOGGER.info("📤 [DELIVERY] Alerta {}: {} enviado(s), {} falha(s), {} retido(s)",
                    alertId, summary.getSent(), summary.getFailed(), summary.getHeld());

        if (summary.getEscalations() > 0) {
            dispatchAsync(alertId);
        }
        return summary;
    }

    @Override
    public boolean requeueRecurring(String alertId) {
        return lockManager.executeInLock(alertId, () -> {
            Alert alert = alertRepository.findByAlertId(alertId)
                .orElseThrow(() -> new AlertNotFoundException(alertId));
            LocalDateTime now = LocalDateTime.now(clock);
            LocalDateTime next = alert.getNextRecurrenceAt();
            if (alert.isClosed() || next == null || next.isAfter(now)) {
                return false;
            }

            for (AlertRecipient recipient : alert.getRecipients()) {
                for (RecipientDeliveryStatus status : recipient.getDeliveryStatuses()) {
                    status.setState(RecipientDeliveryStatus.DeliveryState.PENDING);
                    status.setStatusAt(now);
                    status.setErrorMessage(null);
                    status.setClaimedAt(null);
                    status.setHeldUntil(null);
                }
            }
            alert.setLastDispatchedAt(now);
            alert.recomputeDeliveryStatistics();
            alertRepository.save(alert);
            LOGGER.info("🔁 [DELIVERY] Alerta recorrente {} reaberto para novo ciclo", alertId);
            return true;
        });
    }

    // ============================================
    // FASE 1: REIVINDICAÇÃO
    // ============================================

    private ClaimedBatch claim(String alertId, boolean includeBatched) {
        Alert alert = alertRepository.findByAlertId(alertId)
            .orElseThrow(() -> new AlertNotFoundException(alertId));
        LocalDateTime now = LocalDateTime.now(clock);
        ClaimedBatch batch = new ClaimedBatch();

        if (alert.isClosed()) {
            return batch;
        }
        if (alert.getScheduledFor() != null && alert.getScheduledFor().isAfter(now)) {
            return batch;
        }

        LocalDateTime staleClaimBefore = now.minusSeconds(2L * sendTimeoutSeconds);
        ZonedDateTime localNow = toAlertZone(alert, now);
        boolean bypassDoNotDisturb = alert.getPriority() == Alert.AlertPriority.EMERGENCY;

        for (AlertRecipient recipient : alert.getRecipients()) {
            if (!includeBatched && recipient.getFrequency() != AlertRecipient.DeliveryFrequency.IMMEDIATE) {
                continue;
            }
            boolean inDoNotDisturb = !bypassDoNotDisturb && recipient.isWithinDoNotDisturb(localNow.toLocalTime());

            for (Alert.DeliveryChannel channel : recipient.orderedChannels()) {
                RecipientDeliveryStatus status = recipient.deliveryStatusFor(channel, now);
                if (!status.isDispatchable(now, staleClaimBefore)) {
                    continue;
                }
                if (inDoNotDisturb) {
                    status.setHeldUntil(endOfDoNotDisturb(recipient, localNow));
                    batch.held++;
                    continue;
                }
                status.setHeldUntil(null);
                status.setClaimedAt(now);
                batch.tasks.add(new SendTask(recipient.getUserId(), channel));
            }
        }

        renderContents(alert, batch);
        alertRepository.save(alert);
        return batch;
    }

    private void renderContents(Alert alert, ClaimedBatch batch) {
        if (batch.tasks.isEmpty()) {
            return;
        }
        Set<String> userIds = new LinkedHashSet<>();
        for (SendTask task : batch.tasks) {
            userIds.add(task.userId);
        }
        Map<String, DirectoryUser> users = userDirectory.findUsers(userIds);
        for (SendTask task : batch.tasks) {
            task.content = templateService.render(alert, task.channel, users.get(task.userId));
        }
    }

    // ============================================
    // FASE 2: ENVIO
    // ============================================

    private List<SendOutcome> send(ClaimedBatch batch) {
        List<CompletableFuture<SendOutcome>> futures = new ArrayList<>();

        for (SendTask task : batch.tasks) {
            CompletableFuture<SendOutcome> future = CompletableFuture
                .supplyAsync(() -> channelSender.send(task.userId, task.channel, task.content), sendExecutor)
                .orTimeout(sendTimeoutSeconds, TimeUnit.SECONDS)
                .handle((result, error) -> {
                    if (error != null) {
                        return new SendOutcome(task, ChannelSendResult.failed(describe(error)));
                    }
                    if (result == null) {
                        return new SendOutcome(task, ChannelSendResult.failed("Gateway não retornou resultado"));
                    }
                    return new SendOutcome(task, result);
                });
            futures.add(future);
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<SendOutcome> outcomes = new ArrayList<>();
        for (CompletableFuture<SendOutcome> future : futures) {
            outcomes.add(future.join());
        }
        return outcomes;
    }

    private String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            return "Timeout após " + sendTimeoutSeconds + "s";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    // ============================================
    // FASE 3: REGISTRO
    // ============================================

    private DispatchSummary record(String alertId, List<SendOutcome> outcomes) {
        Alert alert = alertRepository.findByAlertId(alertId)
            .orElseThrow(() -> new AlertNotFoundException(alertId));
        LocalDateTime now = LocalDateTime.now(clock);
        DispatchSummary summary = new DispatchSummary(alertId);

        // Uma tentativa por canal, na ordem de primeiro uso
        Map<Alert.DeliveryChannel, DeliveryAttempt> attempts = new EnumMap<>(Alert.DeliveryChannel.class);
        List<Alert.DeliveryChannel> attemptOrder = new ArrayList<>();

        for (SendOutcome outcome : outcomes) {
            AlertRecipient recipient = alert.findRecipient(outcome.task.userId).orElse(null);
            if (recipient == null) {
                continue;
            }
            RecipientDeliveryStatus status = recipient.deliveryStatusFor(outcome.task.channel, now);
            if (!status.isPending()) {
                // Recibo do gateway chegou antes do registro
                continue;
            }

            DeliveryAttempt attempt = attempts.get(outcome.task.channel);
            if (attempt == null) {
                attempt = new DeliveryAttempt(0, outcome.task.channel, now);
                attempts.put(outcome.task.channel, attempt);
                attemptOrder.add(outcome.task.channel);
            }

            status.setClaimedAt(null);
            status.setStatusAt(now);
            if (outcome.result.isAccepted()) {
                status.setState(RecipientDeliveryStatus.DeliveryState.SENT);
                status.setErrorMessage(null);
                attempt.recordSuccess();
                summary.recordSent();
            } else {
                status.setState(RecipientDeliveryStatus.DeliveryState.FAILED);
                status.setErrorMessage(outcome.result.getError());
                attempt.recordFailure(outcome.task.userId + ": " + outcome.result.getError());
                summary.recordFailed();
            }
        }

        for (Alert.DeliveryChannel channel : attemptOrder) {
            DeliveryAttempt attempt = attempts.get(channel);
            attempt.setAttemptNumber(alert.getDeliveryAttempts().size() + 1);
            alert.addDeliveryAttempt(attempt);
        }

        if (summary.getSent() > 0) {
            alert.setLastDispatchedAt(now);
        }
        alert.recomputeDeliveryStatistics();

        List<EscalationChainEntry> escalations = escalationService.evaluateDeliveryFailureRules(
            alert, summary.getAttempted(), summary.getFailed(), now);
        summary.recordEscalations(escalations.size());

        alert.setUpdatedAt(now);
        alertRepository.save(alert);
        return summary;
    }

    // ============================================
    // AUXILIARES
    // ============================================

    private ZoneId zoneOf(Alert alert) {
        try {
            return alert.getTimezone() != null ? ZoneId.of(alert.getTimezone()) : DEFAULT_ZONE;
        } catch (java.time.DateTimeException e) {
            LOGGER.warn("⚠️ [DELIVERY] Fuso horário inválido '{}' no alerta {}, usando {}",
                        alert.getTimezone(), alert.getAlertId(), DEFAULT_ZONE);
            return DEFAULT_ZONE;
        }
    }

    private ZonedDateTime toAlertZone(Alert alert, LocalDateTime now) {
        return now.atZone(clock.getZone()).withZoneSameInstant(zoneOf(alert));
    }

    private LocalDateTime endOfDoNotDisturb(AlertRecipient recipient, ZonedDateTime localNow) {
        ZonedDateTime end = localNow.with(recipient.getDoNotDisturbEnd());
        if (!end.isAfter(localNow)) {
            end = end.plusDays(1);
        }
        return end.withZoneSameInstant(clock.getZone()).toLocalDateTime();
    }

    private LocalDateTime startOfNextDay(Alert alert, LocalDateTime now) {
        ZonedDateTime localNow = toAlertZone(alert, now);
        return localNow.toLocalDate().plusDays(1).atStartOfDay(localNow.getZone())
            .withZoneSameInstant(clock.getZone())
            .toLocalDateTime();
    }

    private static final class SendTask {
        private final String userId;
        private final Alert.DeliveryChannel channel;
        private NotificationContent content;

        private SendTask(String userId, Alert.DeliveryChannel channel) {
            this.userId = userId;
            this.channel = channel;
        }
    }

    private static final class SendOutcome {
        private final SendTask task;
        private final ChannelSendResult result;

        private SendOutcome(SendTask task, ChannelSendResult result) {
            this.task = task;
            this.result = result;
        }
    }

    private static final class ClaimedBatch {
        private final List<SendTask> tasks = new ArrayList<>();
        private int held;
    }
}
