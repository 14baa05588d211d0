package com.seveninterprise.healthalert.dto;

import jakarta.validation.constraints.Size;

public class CancelAlertRequest {

    @Size(max = 500, message = "Reason cannot exceed 500 characters")
    private String reason;

    public CancelAlertRequest() {}

    public CancelAlertRequest(String reason) {
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
