package com.seveninterprise.healthalert.controllers;

import com.seveninterprise.healthalert.dto.AcknowledgeAlertRequest;
import com.seveninterprise.healthalert.dto.AlertSearchCriteria;
import com.seveninterprise.healthalert.dto.BulkAlertRequest;
import com.seveninterprise.healthalert.dto.BulkAlertResponse;
import com.seveninterprise.healthalert.dto.CancelAlertRequest;
import com.seveninterprise.healthalert.dto.CreateAlertRequest;
import com.seveninterprise.healthalert.dto.DeliveryReceiptRequest;
import com.seveninterprise.healthalert.dto.ErrorResponse;
import com.seveninterprise.healthalert.dto.EscalateAlertRequest;
import com.seveninterprise.healthalert.dto.ResolveAlertRequest;
import com.seveninterprise.healthalert.dto.UpdateAlertStatusRequest;
import com.seveninterprise.healthalert.exceptions.AlertAccessDeniedException;
import com.seveninterprise.healthalert.exceptions.AlertClosedException;
import com.seveninterprise.healthalert.exceptions.AlertNotFoundException;
import com.seveninterprise.healthalert.exceptions.AlertValidationException;
import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.UserRole;
import com.seveninterprise.healthalert.services.IAlertService;

import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.Arrays;

@RestController
@RequestMapping("/api/alerts")
public class AlertController implements IAlertController {

    private static final Logger LOGGER = LoggerFactory.getLogger(AlertController.class);
    private static final int MAX_PAGE_SIZE = 100;

    private final IAlertService alertService;

    public AlertController(IAlertService alertService) {
        this.alertService = alertService;
    }

    /**
     * Obtém a authentication do contexto de segurança
     */
    private Authentication getAuthentication() {
        return SecurityContextHolder.getContext().getAuthentication();
    }

    /**
     * userId do diretório (subject do token)
     */
    private String getAuthenticatedUserId() {
        return getAuthentication().getName();
    }

    /**
     * Verifica se o usuário autenticado tem algum dos papéis
     */
    private boolean hasAnyRole(UserRole... roles) {
        return getAuthentication().getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .anyMatch(authority -> Arrays.stream(roles).anyMatch(role -> authority.equals("ROLE_" + role.name())));
    }

    private ResponseEntity<ErrorResponse> forbidden(String message) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(new ErrorResponse(message, "FORBIDDEN", 403));
    }

    @Override
    @PostMapping
    public ResponseEntity<?> createAlert(@Valid @RequestBody CreateAlertRequest request) {
        if (!hasAnyRole(UserRole.ASHA_WORKER, UserRole.HEALTH_OFFICIAL, UserRole.ADMIN)) {
            return forbidden("Apenas agentes ASHA, autoridades de saúde e administradores podem criar alertas");
        }
        try {
            Alert alert = alertService.createAlert(request, getAuthenticatedUserId());
            return ResponseEntity.status(HttpStatus.CREATED).body(alert);
        } catch (RuntimeException e) {
            return handleException(e, null);
        }
    }

    @Override
    @PostMapping("/bulk")
    public ResponseEntity<?> createBulkAlerts(@Valid @RequestBody BulkAlertRequest request) {
        if (!hasAnyRole(UserRole.HEALTH_OFFICIAL, UserRole.ADMIN)) {
            return forbidden("Apenas autoridades de saúde e administradores podem enviar alertas em lote");
        }
        try {
            BulkAlertResponse response = alertService.createAlerts(request, getAuthenticatedUserId());
            return ResponseEntity.ok(response);
        } catch (RuntimeException e) {
            return handleException(e, null);
        }
    }

    @GetMapping
    public ResponseEntity<?> listAlerts(
            @RequestParam(required = false) Alert.AlertStatus status,
            @RequestParam(required = false) Alert.AlertType alertType,
            @RequestParam(required = false) Alert.AlertLevel level,
            @RequestParam(required = false) Alert.AlertPriority priority,
            @RequestParam(required = false) String villageId,
            @RequestParam(required = false) String blockId,
            @RequestParam(required = false) String districtId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime createdFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime createdTo,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        try {
            AlertSearchCriteria criteria = new AlertSearchCriteria();
            criteria.setStatus(status);
            criteria.setAlertType(alertType);
            criteria.setLevel(level);
            criteria.setPriority(priority);
            criteria.setVillageId(villageId);
            criteria.setBlockId(blockId);
            criteria.setDistrictId(districtId);
            criteria.setCreatedFrom(createdFrom);
            criteria.setCreatedTo(createdTo);

            PageRequest pageable = PageRequest.of(Math.max(0, page), Math.min(Math.max(1, size), MAX_PAGE_SIZE),
                    Sort.by(Sort.Direction.DESC, "createdAt"));
            return ResponseEntity.ok(alertService.listAlerts(criteria, pageable));
        } catch (RuntimeException e) {
            return handleException(e, null);
        }
    }

    @GetMapping("/my-alerts")
    public ResponseEntity<?> getMyActiveAlerts() {
        try {
            return ResponseEntity.ok(alertService.getActiveAlertsForUser(getAuthenticatedUserId()));
        } catch (RuntimeException e) {
            return handleException(e, null);
        }
    }

    @GetMapping("/area")
    public ResponseEntity<?> getAlertsByTypeAndArea(
            @RequestParam Alert.AlertType alertType,
            @RequestParam(required = false) String villageId,
            @RequestParam(required = false) String blockId,
            @RequestParam(required = false) String districtId) {
        try {
            return ResponseEntity.ok(alertService.getAlertsByTypeAndArea(alertType, villageId, blockId, districtId));
        } catch (RuntimeException e) {
            return handleException(e, null);
        }
    }

    @GetMapping("/statistics/delivery")
    public ResponseEntity<?> getDeliveryStatisticsByType(@RequestParam(defaultValue = "30") int days) {
        if (!hasAnyRole(UserRole.HEALTH_OFFICIAL, UserRole.ADMIN)) {
            return forbidden("Apenas autoridades de saúde e administradores podem ver o painel de entregas");
        }
        try {
            return ResponseEntity.ok(alertService.getDeliveryStatisticsByType(days));
        } catch (RuntimeException e) {
            return handleException(e, null);
        }
    }

    @Override
    @GetMapping("/{alertId}")
    public ResponseEntity<?> getAlert(@PathVariable String alertId) {
        try {
            return ResponseEntity.ok(alertService.getAlert(alertId));
        } catch (RuntimeException e) {
            return handleException(e, alertId);
        }
    }

    @GetMapping("/{alertId}/statistics")
    public ResponseEntity<?> getDeliveryStatistics(@PathVariable String alertId) {
        try {
            return ResponseEntity.ok(alertService.getDeliveryStatistics(alertId));
        } catch (RuntimeException e) {
            return handleException(e, alertId);
        }
    }

    @GetMapping("/{alertId}/escalations")
    public ResponseEntity<?> getEscalationChain(@PathVariable String alertId) {
        try {
            return ResponseEntity.ok(alertService.getEscalationChain(alertId));
        } catch (RuntimeException e) {
            return handleException(e, alertId);
        }
    }

    @GetMapping("/{alertId}/history")
    public ResponseEntity<?> getStatusHistory(@PathVariable String alertId) {
        try {
            return ResponseEntity.ok(alertService.getStatusHistory(alertId));
        } catch (RuntimeException e) {
            return handleException(e, alertId);
        }
    }

    @Override
    @PutMapping("/{alertId}/acknowledge")
    public ResponseEntity<?> acknowledgeAlert(@PathVariable String alertId,
                                              @RequestBody(required = false) AcknowledgeAlertRequest request) {
        try {
            return ResponseEntity.ok(alertService.acknowledge(alertId, getAuthenticatedUserId(), request));
        } catch (RuntimeException e) {
            return handleException(e, alertId);
        }
    }

    @Override
    @PutMapping("/{alertId}/resolve")
    public ResponseEntity<?> resolveAlert(@PathVariable String alertId,
                                          @Valid @RequestBody(required = false) ResolveAlertRequest request) {
        if (!hasAnyRole(UserRole.HEALTH_OFFICIAL, UserRole.ADMIN)) {
            return forbidden("Apenas autoridades de saúde e administradores podem resolver alertas");
        }
        try {
            return ResponseEntity.ok(alertService.resolve(alertId, getAuthenticatedUserId(), request));
        } catch (RuntimeException e) {
            return handleException(e, alertId);
        }
    }

    @Override
    @PutMapping("/{alertId}/escalate")
    public ResponseEntity<?> escalateAlert(@PathVariable String alertId,
                                           @Valid @RequestBody EscalateAlertRequest request) {
        if (!hasAnyRole(UserRole.HEALTH_OFFICIAL, UserRole.ADMIN)) {
            return forbidden("Apenas autoridades de saúde e administradores podem escalar alertas");
        }
        try {
            return ResponseEntity.ok(alertService.escalate(alertId, getAuthenticatedUserId(), request));
        } catch (RuntimeException e) {
            return handleException(e, alertId);
        }
    }

    @PutMapping("/{alertId}/cancel")
    public ResponseEntity<?> cancelAlert(@PathVariable String alertId,
                                         @RequestBody(required = false) CancelAlertRequest request) {
        if (!hasAnyRole(UserRole.ADMIN)) {
            return forbidden("Apenas administradores podem cancelar alertas");
        }
        try {
            String reason = request != null ? request.getReason() : null;
            return ResponseEntity.ok(alertService.cancel(alertId, getAuthenticatedUserId(), reason));
        } catch (RuntimeException e) {
            return handleException(e, alertId);
        }
    }

    @PutMapping("/{alertId}/status")
    public ResponseEntity<?> updateAlertStatus(@PathVariable String alertId,
                                               @Valid @RequestBody UpdateAlertStatusRequest request) {
        if (!hasAnyRole(UserRole.ADMIN)) {
            return forbidden("Apenas administradores podem alterar o status de alertas");
        }
        try {
            return ResponseEntity.ok(alertService.updateStatus(alertId, getAuthenticatedUserId(), request));
        } catch (RuntimeException e) {
            return handleException(e, alertId);
        }
    }

    @PostMapping("/{alertId}/delivery-receipts")
    public ResponseEntity<?> recordDeliveryReceipt(@PathVariable String alertId,
                                                   @Valid @RequestBody DeliveryReceiptRequest request) {
        if (!hasAnyRole(UserRole.HEALTH_OFFICIAL, UserRole.ADMIN)) {
            return forbidden("Apenas integrações autorizadas podem registrar recibos de entrega");
        }
        try {
            return ResponseEntity.ok(alertService.recordDeliveryReceipt(alertId, request));
        } catch (RuntimeException e) {
            return handleException(e, alertId);
        }
    }

    /**
     * Trata exceções e retorna a resposta HTTP apropriada
     */
    private ResponseEntity<?> handleException(RuntimeException e, String alertId) {
        HttpStatus status;
        if (e instanceof AlertNotFoundException) {
            status = HttpStatus.NOT_FOUND;
        } else if (e instanceof AlertValidationException) {
            status = HttpStatus.BAD_REQUEST;
        } else if (e instanceof AlertClosedException || e instanceof OptimisticLockingFailureException) {
            status = HttpStatus.CONFLICT;
        } else if (e instanceof AlertAccessDeniedException) {
            status = HttpStatus.FORBIDDEN;
        } else {
            LOGGER.error("❌ [API] Erro interno na operação do alerta {}: {}", alertId, e.getMessage(), e);
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }

        String message = status == HttpStatus.INTERNAL_SERVER_ERROR ? "Erro interno: " + e.getMessage() : e.getMessage();
        ErrorResponse body = new ErrorResponse(message, status.name(), status.value());
        body.setAlertId(alertId);
        return ResponseEntity.status(status).body(body);
    }
}
