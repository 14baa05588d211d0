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
import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.AlertStatusChange;
import com.seveninterprise.healthalert.model.EscalationChainEntry;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.List;

/**
 * Interface para operações de alertas
 *
 * Segue o padrão de Interface Segregation Principle (ISP) e
 * Dependency Inversion Principle (DIP) do SOLID
 */
public interface IAlertService {

    /**
     * Cria um alerta a partir de um gatilho (operador ou sistema externo)
     *
     * Processo:
     * 1. Valida o pedido (expiração, regras de escalação, fuso horário)
     * 2. Atribui o identificador ALT-SYS-####
     * 3. Resolve os destinatários pelo público-alvo e enfileira as entregas
     * 4. Registra regras e timers de escalação; regras de severidade disparam aqui
     * 5. Persiste tudo em uma única transação
     * 6. Após o commit, entrega em segundo plano (exceto se agendado para o futuro)
     *
     * @throws com.seveninterprise.healthalert.exceptions.AlertValidationException pedido inválido
     * @throws com.seveninterprise.healthalert.exceptions.NoRecipientsException nenhum destinatário encontrado
     */
    Alert createAlert(CreateAlertRequest request, String createdBy);

    /**
     * Cria vários alertas, cada um em sua própria transação
     */
    BulkAlertResponse createAlerts(BulkAlertRequest request, String createdBy);

    /**
     * Registra o reconhecimento de um destinatário. Ao atingir
     * ceil(50% dos destinatários) usuários distintos, o alerta ACTIVE passa
     * para ACKNOWLEDGED.
     */
    Alert acknowledge(String alertId, String userId, AcknowledgeAlertRequest request);

    Alert resolve(String alertId, String resolvedBy, ResolveAlertRequest request);

    /**
     * Escalação manual com a semântica de ESCALATE_TO_SUPERVISOR
     */
    Alert escalate(String alertId, String escalatedBy, EscalateAlertRequest request);

    Alert cancel(String alertId, String cancelledBy, String reason);

    /**
     * Alteração administrativa de status (EXPIRED, RESOLVED ou CANCELLED)
     */
    Alert updateStatus(String alertId, String changedBy, UpdateAlertStatusRequest request);

    /**
     * Confirmação do gateway (DELIVERED, READ ou FAILED) para um par destinatário × canal
     */
    Alert recordDeliveryReceipt(String alertId, DeliveryReceiptRequest request);

    Alert getAlert(String alertId);

    DeliveryStatisticsResponse getDeliveryStatistics(String alertId);

    List<EscalationChainEntry> getEscalationChain(String alertId);

    List<AlertStatusChange> getStatusHistory(String alertId);

    Page<Alert> listAlerts(AlertSearchCriteria criteria, Pageable pageable);

    /**
     * Alertas ativos do usuário, mais prioritários e mais recentes primeiro (máximo 50)
     */
    List<Alert> getActiveAlertsForUser(String userId);

    List<Alert> getAlertsByTypeAndArea(Alert.AlertType alertType, String villageId, String blockId, String districtId);

    /**
     * Agregado de entrega por tipo de alerta nos últimos N dias
     */
    List<DeliveryTypeStatistics> getDeliveryStatisticsByType(int days);
}
