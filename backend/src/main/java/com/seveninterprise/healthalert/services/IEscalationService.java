package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.EscalationChainEntry;
import com.seveninterprise.healthalert.model.EscalationRule;
import com.seveninterprise.healthalert.model.EscalationTimer;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Aplicação das ações de escalação sobre um alerta já carregado
 *
 * Todos os métodos devem ser chamados dentro da transação do lock do alerta.
 */
public interface IEscalationService {

    /**
     * Registra o timer inicial derivado do nível e os timers das regras TIME_BASED
     */
    void registerTimers(Alert alert, LocalDateTime now);

    /**
     * Dispara regras SEVERITY_BASED cujo limiar é atingido pelo nível atual
     */
    List<EscalationChainEntry> evaluateSeverityRules(Alert alert, LocalDateTime now);

    /**
     * Dispara regras DELIVERY_FAILURE cujo percentual de falhas no lote foi atingido
     */
    List<EscalationChainEntry> evaluateDeliveryFailureRules(Alert alert, int attempted, int failed, LocalDateTime now);

    /**
     * Executa a ação de um timer já reivindicado
     */
    EscalationChainEntry fireTimer(Alert alert, EscalationTimer timer, LocalDateTime now);

    EscalationChainEntry escalate(Alert alert, EscalationRule.EscalationAction action, List<String> escalateTo,
                                  String escalatedBy, String reason, LocalDateTime now);
}
