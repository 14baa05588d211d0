package com.seveninterprise.healthalert.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * Histórico append-only de transições de status
 */
@Entity
@Table(name = "alert_status_history")
public class AlertStatusChange {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "alert_pk", nullable = false)
    private Alert alert;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status")
    private Alert.AlertStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false)
    private Alert.AlertStatus toStatus;

    @Column(name = "changed_by")
    private String changedBy;

    @Column(name = "changed_at", nullable = false)
    private LocalDateTime changedAt;

    @Column(name = "reason", length = 500)
    private String reason;

    public AlertStatusChange() {}

    public AlertStatusChange(Alert.AlertStatus fromStatus, Alert.AlertStatus toStatus,
                             String changedBy, LocalDateTime changedAt, String reason) {
        this.fromStatus = fromStatus;
        this.toStatus = toStatus;
        this.changedBy = changedBy;
        this.changedAt = changedAt;
        this.reason = reason;
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Alert getAlert() {
        return alert;
    }

    public void setAlert(Alert alert) {
        this.alert = alert;
    }

    public Alert.AlertStatus getFromStatus() {
        return fromStatus;
    }

    public void setFromStatus(Alert.AlertStatus fromStatus) {
        this.fromStatus = fromStatus;
    }

    public Alert.AlertStatus getToStatus() {
        return toStatus;
    }

    public void setToStatus(Alert.AlertStatus toStatus) {
        this.toStatus = toStatus;
    }

    public String getChangedBy() {
        return changedBy;
    }

    public void setChangedBy(String changedBy) {
        this.changedBy = changedBy;
    }

    public LocalDateTime getChangedAt() {
        return changedAt;
    }

    public void setChangedAt(LocalDateTime changedAt) {
        this.changedAt = changedAt;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
