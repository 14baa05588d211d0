package com.seveninterprise.healthalert.repositories;

import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.EscalationTimer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Repositório dos timers de escalação (índice "next due" do motor)
 */
@Repository
public interface EscalationTimerRepository extends JpaRepository<EscalationTimer, Long> {

    interface DueTimer {
        Long getTimerId();
        String getAlertId();
    }

    /**
     * Timers ativos vencidos de alertas no status informado, mais antigos primeiro
     */
    @Query("SELECT t.id AS timerId, a.alertId AS alertId FROM EscalationTimer t JOIN t.alert a WHERE " +
           "t.active = true AND t.triggerTime <= :now AND a.status = :status " +
           "ORDER BY t.triggerTime ASC")
    List<DueTimer> findDueTimers(@Param("now") LocalDateTime now,
                                 @Param("status") Alert.AlertStatus status);

    /**
     * Compare-and-set do flag ativo. Retorna 1 apenas para quem reivindicou o timer.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE EscalationTimer t SET t.active = false, t.firedAt = :firedAt " +
           "WHERE t.id = :timerId AND t.active = true")
    int claim(@Param("timerId") Long timerId, @Param("firedAt") LocalDateTime firedAt);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE EscalationTimer t SET t.active = false WHERE t.active = true AND t.alert.id IN :alertPks")
    int deactivateForAlerts(@Param("alertPks") Collection<Long> alertPks);

    long countByAlertAlertIdAndActiveTrue(String alertId);
}
