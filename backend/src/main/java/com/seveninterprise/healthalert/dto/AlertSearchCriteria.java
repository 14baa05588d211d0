package com.seveninterprise.healthalert.dto;

import com.seveninterprise.healthalert.model.Alert;

import java.time.LocalDateTime;

/**
 * Filtros opcionais da listagem de alertas
 */
public class AlertSearchCriteria {

    private Alert.AlertStatus status;
    private Alert.AlertType alertType;
    private Alert.AlertLevel level;
    private Alert.AlertPriority priority;
    private String villageId;
    private String blockId;
    private String districtId;
    private LocalDateTime createdFrom;
    private LocalDateTime createdTo;

    public Alert.AlertStatus getStatus() {
        return status;
    }

    public void setStatus(Alert.AlertStatus status) {
        this.status = status;
    }

    public Alert.AlertType getAlertType() {
        return alertType;
    }

    public void setAlertType(Alert.AlertType alertType) {
        this.alertType = alertType;
    }

    public Alert.AlertLevel getLevel() {
        return level;
    }

    public void setLevel(Alert.AlertLevel level) {
        this.level = level;
    }

    public Alert.AlertPriority getPriority() {
        return priority;
    }

    public void setPriority(Alert.AlertPriority priority) {
        this.priority = priority;
    }

    public String getVillageId() {
        return villageId;
    }

    public void setVillageId(String villageId) {
        this.villageId = villageId;
    }

    public String getBlockId() {
        return blockId;
    }

    public void setBlockId(String blockId) {
        this.blockId = blockId;
    }

    public String getDistrictId() {
        return districtId;
    }

    public void setDistrictId(String districtId) {
        this.districtId = districtId;
    }

    public LocalDateTime getCreatedFrom() {
        return createdFrom;
    }

    public void setCreatedFrom(LocalDateTime createdFrom) {
        this.createdFrom = createdFrom;
    }

    public LocalDateTime getCreatedTo() {
        return createdTo;
    }

    public void setCreatedTo(LocalDateTime createdTo) {
        this.createdTo = createdTo;
    }
}
