package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.EscalationChainEntry;
import com.seveninterprise.healthalert.model.EscalationTimer;
import com.seveninterprise.healthalert.repositories.AlertRepository;
import com.seveninterprise.healthalert.repositories.EscalationTimerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Motor de timers de escalação
 *
 * Os timers ficam persistidos; a cada ciclo os vencidos de alertas ACTIVE
 * são disparados. Cada timer é reivindicado por compare-and-set antes de
 * qualquer efeito, então dispara no máximo uma vez mesmo com ciclos
 * sobrepostos, vários nós ou reinício no meio do processamento.
 */
@Service
public class EscalationTimerService {

    private static final Logger LOGGER = LoggerFactory.getLogger(EscalationTimerService.class);

    private final EscalationTimerRepository timerRepository;
    private final AlertRepository alertRepository;
    private final AlertLockManager lockManager;
    private final IEscalationService escalationService;
    private final IDeliveryDispatcher dispatcher;
    private final TransactionTemplate readOnlyTransactionTemplate;
    private final Clock clock;

    public EscalationTimerService(EscalationTimerRepository timerRepository,
                                  AlertRepository alertRepository,
                                  AlertLockManager lockManager,
                                  IEscalationService escalationService,
                                  IDeliveryDispatcher dispatcher,
                                  @Qualifier("readOnlyTransactionTemplate") TransactionTemplate readOnlyTransactionTemplate,
                                  Clock clock) {
        this.timerRepository = timerRepository;
        this.alertRepository = alertRepository;
        this.lockManager = lockManager;
        this.escalationService = escalationService;
        this.dispatcher = dispatcher;
        this.readOnlyTransactionTemplate = readOnlyTransactionTemplate;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${healthalert.escalation.sweep.interval:60000}")
    public void scheduledEscalationSweep() {
        int fired = runEscalationSweep();
        if (fired > 0) {
            LOGGER.info("✅ [ESCALATION] {} timer(s) de escalação disparado(s)", fired);
        }
    }

    /**
     * Dispara os timers vencidos. Retorna quantos efetivamente escalaram.
     */
    public int runEscalationSweep() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<EscalationTimerRepository.DueTimer> dueTimers;
        try {
            dueTimers = readOnlyTransactionTemplate.execute(status ->
                timerRepository.findDueTimers(now, Alert.AlertStatus.ACTIVE));
        } catch (RuntimeException e) {
            // Store indisponível: ciclo inteiro pulado, timers continuam ativos
            LOGGER.error("❌ [ESCALATION] Falha ao consultar timers vencidos, ciclo ignorado: {}", e.getMessage());
            return 0;
        }

        int fired = 0;
        for (EscalationTimerRepository.DueTimer due : dueTimers) {
            try {
                if (fireTimer(due.getAlertId(), due.getTimerId())) {
                    fired++;
                }
            } catch (RuntimeException e) {
                LOGGER.warn("⚠️ [ESCALATION] Erro ao disparar timer {} do alerta {}: {}",
                            due.getTimerId(), due.getAlertId(), e.getMessage());
            }
        }
        return fired;
    }

    /**
     * Reivindica e dispara um timer. Retorna false se outro processo já o
     * reivindicou ou se o alerta não está mais elegível.
     */
    boolean fireTimer(String alertId, Long timerId) {
        Boolean escalated = lockManager.executeInLock(alertId, () -> {
            LocalDateTime now = LocalDateTime.now(clock);
            if (timerRepository.claim(timerId, now) == 0) {
                return false;
            }

            Alert alert = alertRepository.findByAlertId(alertId).orElse(null);
            if (alert == null) {
                return false;
            }
            if (alert.getStatus() != Alert.AlertStatus.ACTIVE || !alert.isAutoEscalationEnabled()) {
                // Reconhecido ou fechado entre a consulta e a reivindicação: timer consumido sem escalar
                return false;
            }

            EscalationTimer timer = alert.getEscalationTimers().stream()
                .filter(t -> timerId.equals(t.getId()))
                .findFirst()
                .orElse(null);
            if (timer == null) {
                return false;
            }
            timer.setActive(false);
            if (timer.getFiredAt() == null) {
                timer.setFiredAt(now);
            }

            EscalationChainEntry entry = escalationService.fireTimer(alert, timer, now);
            alertRepository.save(alert);
            return entry != null;
        });

        if (Boolean.TRUE.equals(escalated)) {
            dispatcher.dispatchAsync(alertId);
            return true;
        }
        return false;
    }
}
