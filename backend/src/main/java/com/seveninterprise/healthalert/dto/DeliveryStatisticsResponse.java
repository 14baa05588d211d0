package com.seveninterprise.healthalert.dto;

import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.DeliveryStatistics;

/**
 * Visão de leitura das estatísticas de entrega e reconhecimento de um alerta
 */
public class DeliveryStatisticsResponse {

    private String alertId;
    private Alert.AlertStatus status;
    private Alert.AlertPriority priority;
    private int totalRecipients;
    private int sent;
    private int delivered;
    private int read;
    private int failed;
    private int deliverySuccessRate;
    private int acknowledgedCount;
    private int acknowledgmentThreshold;
    private Integer responseRate;
    private Double averageResponseMinutes;
    private int escalationCount;

    public static DeliveryStatisticsResponse from(Alert alert) {
        DeliveryStatistics stats = alert.getDeliveryStatistics();
        DeliveryStatisticsResponse response = new DeliveryStatisticsResponse();
        response.alertId = alert.getAlertId();
        response.status = alert.getStatus();
        response.priority = alert.getPriority();
        response.totalRecipients = stats.getTotalRecipients();
        response.sent = stats.getSent();
        response.delivered = stats.getDelivered();
        response.read = stats.getRead();
        response.failed = stats.getFailed();
        response.deliverySuccessRate = alert.getDeliverySuccessRate();
        response.acknowledgedCount = alert.getAcknowledgedUserIds().size();
        response.acknowledgmentThreshold = alert.getAcknowledgmentThreshold();
        response.responseRate = alert.getResponseRate();
        response.averageResponseMinutes = alert.getAverageResponseMinutes();
        response.escalationCount = alert.getEscalationChain().size();
        return response;
    }

    public String getAlertId() {
        return alertId;
    }

    public Alert.AlertStatus getStatus() {
        return status;
    }

    public Alert.AlertPriority getPriority() {
        return priority;
    }

    public int getTotalRecipients() {
        return totalRecipients;
    }

    public int getSent() {
        return sent;
    }

    public int getDelivered() {
        return delivered;
    }

    public int getRead() {
        return read;
    }

    public int getFailed() {
        return failed;
    }

    public int getDeliverySuccessRate() {
        return deliverySuccessRate;
    }

    public int getAcknowledgedCount() {
        return acknowledgedCount;
    }

    public int getAcknowledgmentThreshold() {
        return acknowledgmentThreshold;
    }

    public Integer getResponseRate() {
        return responseRate;
    }

    public Double getAverageResponseMinutes() {
        return averageResponseMinutes;
    }

    public int getEscalationCount() {
        return escalationCount;
    }
}
