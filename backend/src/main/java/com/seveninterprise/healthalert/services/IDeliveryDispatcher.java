package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.model.Alert;

import java.time.LocalDateTime;

/**
 * Dispatcher de entregas por destinatário × canal
 */
public interface IDeliveryDispatcher {

    /**
     * Cria as entregas pendentes de todos os destinatários (sem enviar)
     */
    void queueDeliveries(Alert alert, LocalDateTime now);

    /**
     * Entrega em segundo plano, sem bloquear o chamador
     */
    void dispatchAsync(String alertId);

    /**
     * Reivindica, envia e registra as entregas prontas do alerta.
     * includeBatched=false considera apenas destinatários IMMEDIATE.
     */
    DispatchSummary dispatch(String alertId, boolean includeBatched);

    /**
     * Reabre todas as entregas de um alerta recorrente para um novo ciclo.
     * Retorna false se o ciclo ainda não venceu.
     */
    boolean requeueRecurring(String alertId);
}
