package com.seveninterprise.healthalert.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.ArrayList;
import java.util.List;

public class EscalateAlertRequest {

    @NotEmpty(message = "At least one escalation target is required")
    private List<String> escalateTo = new ArrayList<>();

    @Size(max = 500, message = "Reason cannot exceed 500 characters")
    private String reason;

    public EscalateAlertRequest() {}

    public EscalateAlertRequest(List<String> escalateTo, String reason) {
        this.escalateTo = escalateTo;
        this.reason = reason;
    }

    public List<String> getEscalateTo() {
        return escalateTo;
    }

    public void setEscalateTo(List<String> escalateTo) {
        this.escalateTo = escalateTo;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
