package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.AlertStatusChange;
import com.seveninterprise.healthalert.repositories.AlertRepository;
import com.seveninterprise.healthalert.repositories.AlertStatusChangeRepository;
import com.seveninterprise.healthalert.repositories.EscalationTimerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Arquivamento de alertas expirados
 *
 * Todo alerta com autoArchive e expiresAt no passado vai para ARCHIVED em
 * uma única transação por ciclo, com timers desativados e uma entrada de
 * histórico por alerta. Qualquer status anterior é aceito, inclusive
 * RESOLVED e CANCELLED.
 */
@Service
public class AlertArchivalService {

    private static final Logger LOGGER = LoggerFactory.getLogger(AlertArchivalService.class);

    static final String ARCHIVAL_REASON = "Expirado e arquivado automaticamente";

    private final AlertRepository alertRepository;
    private final EscalationTimerRepository timerRepository;
    private final AlertStatusChangeRepository statusChangeRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public AlertArchivalService(AlertRepository alertRepository,
                                EscalationTimerRepository timerRepository,
                                AlertStatusChangeRepository statusChangeRepository,
                                TransactionTemplate transactionTemplate,
                                Clock clock) {
        this.alertRepository = alertRepository;
        this.timerRepository = timerRepository;
        this.statusChangeRepository = statusChangeRepository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${healthalert.archival.sweep.interval:3600000}")
    public void scheduledArchival() {
        try {
            int archived = archiveExpiredAlerts();
            if (archived > 0) {
                LOGGER.info("🗄️ [ARCHIVAL] {} alerta(s) expirado(s) arquivado(s)", archived);
            }
        } catch (RuntimeException e) {
            // Transação desfeita: nenhum alerta parcialmente arquivado, próximo ciclo tenta de novo
            LOGGER.error("❌ [ARCHIVAL] Erro no arquivamento periódico: {}", e.getMessage(), e);
        }
    }

    /**
     * Arquiva todos os alertas expirados. Retorna quantos foram arquivados.
     */
    public int archiveExpiredAlerts() {
        Integer archived = transactionTemplate.execute(status -> {
            LocalDateTime now = LocalDateTime.now(clock);
            List<AlertRepository.ArchivableAlert> expired =
                alertRepository.findArchivable(now, Alert.AlertStatus.ARCHIVED);
            if (expired.isEmpty()) {
                return 0;
            }

            List<Long> ids = expired.stream()
                .map(AlertRepository.ArchivableAlert::getId)
                .collect(Collectors.toList());

            timerRepository.deactivateForAlerts(ids);
            int updated = alertRepository.archiveByIds(ids, Alert.AlertStatus.ARCHIVED, now);

            List<AlertStatusChange> history = new ArrayList<>();
            for (AlertRepository.ArchivableAlert alert : expired) {
                AlertStatusChange change = new AlertStatusChange(
                    alert.getStatus(), Alert.AlertStatus.ARCHIVED, EscalationService.SYSTEM_ACTOR, now, ARCHIVAL_REASON);
                change.setAlert(alertRepository.getReferenceById(alert.getId()));
                history.add(change);
            }
            statusChangeRepository.saveAll(history);

            LOGGER.debug("🗄️ [ARCHIVAL] Alertas arquivados: {}", expired.stream()
                .map(AlertRepository.ArchivableAlert::getAlertId)
                .collect(Collectors.toList()));
            return updated;
        });
        return archived != null ? archived : 0;
    }
}
