package com.seveninterprise.healthalert.dto;

import com.seveninterprise.healthalert.model.Alert;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Alteração explícita de status por operador (EXPIRED, CANCELLED ou RESOLVED)
 */
public class UpdateAlertStatusRequest {

    @NotNull(message = "Status is required")
    private Alert.AlertStatus status;

    @Size(max = 500, message = "Reason cannot exceed 500 characters")
    private String reason;

    public UpdateAlertStatusRequest() {}

    public UpdateAlertStatusRequest(Alert.AlertStatus status, String reason) {
        this.status = status;
        this.reason = reason;
    }

    public Alert.AlertStatus getStatus() {
        return status;
    }

    public void setStatus(Alert.AlertStatus status) {
        this.status = status;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
