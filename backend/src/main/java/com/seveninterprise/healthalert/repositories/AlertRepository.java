package com.seveninterprise.healthalert.repositories;

import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.RecipientDeliveryStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repositório de alertas
 */
@Repository
public interface AlertRepository extends JpaRepository<Alert, Long> {

    /**
     * Projeção mínima usada pela varredura de arquivamento
     */
    interface ArchivableAlert {
        Long getId();
        String getAlertId();
        Alert.AlertStatus getStatus();
    }

    Optional<Alert> findByAlertId(String alertId);

    boolean existsByAlertId(String alertId);

    /**
     * Listagem com filtros opcionais (parâmetros nulos são ignorados)
     */
    @Query("SELECT a FROM Alert a WHERE " +
           "(:status IS NULL OR a.status = :status) AND " +
           "(:alertType IS NULL OR a.alertType = :alertType) AND " +
           "(:level IS NULL OR a.level = :level) AND " +
           "(:priority IS NULL OR a.priority = :priority) AND " +
           "(:villageId IS NULL OR :villageId MEMBER OF a.affectedVillages) AND " +
           "(:blockId IS NULL OR :blockId MEMBER OF a.affectedBlocks) AND " +
           "(:districtId IS NULL OR :districtId MEMBER OF a.affectedDistricts) AND " +
           "(:createdFrom IS NULL OR a.createdAt >= :createdFrom) AND " +
           "(:createdTo IS NULL OR a.createdAt <= :createdTo)")
    Page<Alert> search(@Param("status") Alert.AlertStatus status,
                       @Param("alertType") Alert.AlertType alertType,
                       @Param("level") Alert.AlertLevel level,
                       @Param("priority") Alert.AlertPriority priority,
                       @Param("villageId") String villageId,
                       @Param("blockId") String blockId,
                       @Param("districtId") String districtId,
                       @Param("createdFrom") LocalDateTime createdFrom,
                       @Param("createdTo") LocalDateTime createdTo,
                       Pageable pageable);

    /**
     * Alertas ativos e não expirados em que o usuário é destinatário
     */
    @Query("SELECT DISTINCT a FROM Alert a JOIN a.recipients r WHERE " +
           "r.userId = :userId AND a.status = :status AND " +
           "(a.expiresAt IS NULL OR a.expiresAt > :now)")
    List<Alert> findActiveForRecipient(@Param("userId") String userId,
                                       @Param("status") Alert.AlertStatus status,
                                       @Param("now") LocalDateTime now);

    /**
     * Alertas de um tipo em uma área (qualquer nível da hierarquia informado)
     */
    @Query("SELECT a FROM Alert a WHERE a.alertType = :alertType AND a.status IN :statuses AND " +
           "(:villageId IS NULL OR :villageId MEMBER OF a.affectedVillages) AND " +
           "(:blockId IS NULL OR :blockId MEMBER OF a.affectedBlocks) AND " +
           "(:districtId IS NULL OR :districtId MEMBER OF a.affectedDistricts) " +
           "ORDER BY a.createdAt DESC")
    List<Alert> findByTypeAndArea(@Param("alertType") Alert.AlertType alertType,
                                  @Param("statuses") Collection<Alert.AlertStatus> statuses,
                                  @Param("villageId") String villageId,
                                  @Param("blockId") String blockId,
                                  @Param("districtId") String districtId);

    /**
     * Agregado por tipo: [tipo, alertas, destinatários, enviados, entregues, lidos, falhas, taxa média de resposta]
     */
    @Query("SELECT a.alertType, COUNT(a), SUM(a.deliveryStatistics.totalRecipients), " +
           "SUM(a.deliveryStatistics.sent), SUM(a.deliveryStatistics.delivered), " +
           "SUM(a.deliveryStatistics.read), SUM(a.deliveryStatistics.failed), AVG(a.responseRate) " +
           "FROM Alert a WHERE a.createdAt >= :since GROUP BY a.alertType")
    List<Object[]> aggregateDeliveryByType(@Param("since") LocalDateTime since);

    /**
     * Alertas abertos com pares destinatário × canal prontos para envio
     * (pendentes, fora da retenção e sem reivindicação válida)
     */
    @Query("SELECT DISTINCT a.alertId FROM Alert a JOIN a.recipients r JOIN r.deliveryStatuses s WHERE " +
           "a.status IN :statuses AND " +
           "(a.scheduledFor IS NULL OR a.scheduledFor <= :now) AND " +
           "s.state = :pending AND " +
           "(s.heldUntil IS NULL OR s.heldUntil <= :now) AND " +
           "(s.claimedAt IS NULL OR s.claimedAt < :staleClaimBefore)")
    List<String> findAlertIdsWithDispatchableDeliveries(@Param("statuses") Collection<Alert.AlertStatus> statuses,
                                                        @Param("pending") RecipientDeliveryStatus.DeliveryState pending,
                                                        @Param("now") LocalDateTime now,
                                                        @Param("staleClaimBefore") LocalDateTime staleClaimBefore);

    /**
     * Alertas recorrentes já enviados ao menos uma vez e ainda dentro da janela de recorrência
     */
    @Query("SELECT a FROM Alert a WHERE a.recurrenceInterval IS NOT NULL AND " +
           "a.lastDispatchedAt IS NOT NULL AND a.status IN :statuses AND " +
           "(a.recurrenceEndDate IS NULL OR a.recurrenceEndDate > :now)")
    List<Alert> findRecurringCandidates(@Param("statuses") Collection<Alert.AlertStatus> statuses,
                                        @Param("now") LocalDateTime now);

    @Query("SELECT a.id AS id, a.alertId AS alertId, a.status AS status FROM Alert a WHERE " +
           "a.expiresAt < :now AND a.autoArchive = true AND a.status <> :archived")
    List<ArchivableAlert> findArchivable(@Param("now") LocalDateTime now,
                                         @Param("archived") Alert.AlertStatus archived);

    /**
     * Arquivamento em lote. Incrementa a versão para invalidar escritas concorrentes.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Alert a SET a.status = :archived, a.version = a.version + 1, a.updatedAt = :now " +
           "WHERE a.id IN :ids AND a.status <> :archived")
    int archiveByIds(@Param("ids") Collection<Long> ids,
                     @Param("archived") Alert.AlertStatus archived,
                     @Param("now") LocalDateTime now);
}
