package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.RecipientDeliveryStatus;
import com.seveninterprise.healthalert.repositories.AlertRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Varredura periódica de entregas
 *
 * Envia pares pendentes que ficaram prontos (agendamento vencido, fim da
 * janela de não perturbe, resumo diário, BATCHED, reivindicação abandonada)
 * e reabre os alertas recorrentes cujo próximo ciclo venceu.
 */
@Service
public class DeliverySweepService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeliverySweepService.class);

    static final Set<Alert.AlertStatus> DELIVERABLE_STATUSES =
        EnumSet.of(Alert.AlertStatus.ACTIVE, Alert.AlertStatus.ACKNOWLEDGED);

    private final AlertRepository alertRepository;
    private final IDeliveryDispatcher dispatcher;
    private final TransactionTemplate readOnlyTransactionTemplate;
    private final Clock clock;

    @Value("${healthalert.delivery.send.timeout:10}")
    private int sendTimeoutSeconds;

    public DeliverySweepService(AlertRepository alertRepository,
                                IDeliveryDispatcher dispatcher,
                                @Qualifier("readOnlyTransactionTemplate") TransactionTemplate readOnlyTransactionTemplate,
                                Clock clock) {
        this.alertRepository = alertRepository;
        this.dispatcher = dispatcher;
        this.readOnlyTransactionTemplate = readOnlyTransactionTemplate;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${healthalert.delivery.sweep.interval:60000}")
    public void scheduledDeliverySweep() {
        try {
            int requeued = requeueDueRecurrences();
            int dispatched = dispatchPendingDeliveries();
            if (requeued > 0 || dispatched > 0) {
                LOGGER.info("✅ [DELIVERY] Varredura concluída: {} alerta(s) entregue(s), {} recorrência(s) reaberta(s)",
                            dispatched, requeued);
            }
        } catch (RuntimeException e) {
            LOGGER.error("❌ [DELIVERY] Erro na varredura periódica de entregas: {}", e.getMessage(), e);
        }
    }

    /**
     * Entrega os pares prontos de todos os alertas abertos. Retorna quantos alertas enviaram algo.
     */
    public int dispatchPendingDeliveries() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime staleClaimBefore = now.minusSeconds(2L * sendTimeoutSeconds);
        List<String> alertIds = readOnlyTransactionTemplate.execute(status ->
            alertRepository.findAlertIdsWithDispatchableDeliveries(
                DELIVERABLE_STATUSES, RecipientDeliveryStatus.DeliveryState.PENDING, now, staleClaimBefore));

        int dispatched = 0;
        for (String alertId : alertIds) {
            try {
                DispatchSummary summary = dispatcher.dispatch(alertId, true);
                if (summary.getAttempted() > 0) {
                    dispatched++;
                }
            } catch (RuntimeException e) {
                // Um alerta com falha não impede os demais; próximo ciclo tenta de novo
                LOGGER.warn("⚠️ [DELIVERY] Erro ao entregar alerta {}: {}", alertId, e.getMessage());
            }
        }
        return dispatched;
    }

    /**
     * Reabre as entregas dos alertas recorrentes cujo ciclo venceu. Retorna quantos foram reabertos.
     */
    public int requeueDueRecurrences() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<String> dueAlertIds = readOnlyTransactionTemplate.execute(status ->
            alertRepository.findRecurringCandidates(DELIVERABLE_STATUSES, now).stream()
                .filter(alert -> {
                    LocalDateTime next = alert.getNextRecurrenceAt();
                    return next != null && !next.isAfter(now);
                })
                .map(Alert::getAlertId)
                .collect(Collectors.toList()));

        int requeued = 0;
        for (String alertId : dueAlertIds) {
            try {
                if (dispatcher.requeueRecurring(alertId)) {
                    requeued++;
                }
            } catch (RuntimeException e) {
                LOGGER.warn("⚠️ [DELIVERY] Erro ao reabrir recorrência do alerta {}: {}", alertId, e.getMessage());
            }
        }
        return requeued;
    }
}
