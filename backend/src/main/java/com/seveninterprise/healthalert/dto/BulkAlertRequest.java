package com.seveninterprise.healthalert.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.ArrayList;
import java.util.List;

public class BulkAlertRequest {

    @NotEmpty(message = "At least one alert is required")
    @Valid
    private List<CreateAlertRequest> alerts = new ArrayList<>();

    private boolean stopOnFirstFailure;

    public BulkAlertRequest() {}

    public BulkAlertRequest(List<CreateAlertRequest> alerts, boolean stopOnFirstFailure) {
        this.alerts = alerts;
        this.stopOnFirstFailure = stopOnFirstFailure;
    }

    public List<CreateAlertRequest> getAlerts() {
        return alerts;
    }

    public void setAlerts(List<CreateAlertRequest> alerts) {
        this.alerts = alerts;
    }

    public boolean isStopOnFirstFailure() {
        return stopOnFirstFailure;
    }

    public void setStopOnFirstFailure(boolean stopOnFirstFailure) {
        this.stopOnFirstFailure = stopOnFirstFailure;
    }
}
