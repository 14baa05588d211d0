package com.seveninterprise.healthalert.dto;

import com.seveninterprise.healthalert.model.Alert;

/**
 * Agregação por tipo de alerta para o dashboard
 */
public class DeliveryTypeStatistics {

    private final Alert.AlertType alertType;
    private final long totalAlerts;
    private final long totalRecipients;
    private final long sent;
    private final long delivered;
    private final long read;
    private final long failed;
    private final Double averageResponseRate;

    public DeliveryTypeStatistics(Alert.AlertType alertType, long totalAlerts, long totalRecipients,
                                  long sent, long delivered, long read, long failed, Double averageResponseRate) {
        this.alertType = alertType;
        this.totalAlerts = totalAlerts;
        this.totalRecipients = totalRecipients;
        this.sent = sent;
        this.delivered = delivered;
        this.read = read;
        this.failed = failed;
        this.averageResponseRate = averageResponseRate;
    }

    public Alert.AlertType getAlertType() {
        return alertType;
    }

    public long getTotalAlerts() {
        return totalAlerts;
    }

    public long getTotalRecipients() {
        return totalRecipients;
    }

    public long getSent() {
        return sent;
    }

    public long getDelivered() {
        return delivered;
    }

    public long getRead() {
        return read;
    }

    public long getFailed() {
        return failed;
    }

    public Double getAverageResponseRate() {
        return averageResponseRate;
    }
}
