package com.seveninterprise.healthalert.controllers;

import com.seveninterprise.healthalert.dto.AcknowledgeAlertRequest;
import com.seveninterprise.healthalert.dto.BulkAlertRequest;
import com.seveninterprise.healthalert.dto.CreateAlertRequest;
import com.seveninterprise.healthalert.dto.EscalateAlertRequest;
import com.seveninterprise.healthalert.dto.ResolveAlertRequest;
import org.springframework.http.ResponseEntity;

/**
 * Interface for alert controller operations
 */
public interface IAlertController {

    /**
     * Creates an alert and starts background delivery
     * @param request Alert definition
     * @return 201 with the created alert, 400 on invalid targeting, 403 without role
     */
    ResponseEntity<?> createAlert(CreateAlertRequest request);

    /**
     * Creates several alerts, reporting each item separately
     */
    ResponseEntity<?> createBulkAlerts(BulkAlertRequest request);

    /**
     * Gets an alert by its ALT-SYS identifier
     */
    ResponseEntity<?> getAlert(String alertId);

    /**
     * Acknowledges an alert on behalf of the authenticated recipient
     */
    ResponseEntity<?> acknowledgeAlert(String alertId, AcknowledgeAlertRequest request);

    ResponseEntity<?> resolveAlert(String alertId, ResolveAlertRequest request);

    ResponseEntity<?> escalateAlert(String alertId, EscalateAlertRequest request);
}
