package com.seveninterprise.healthalert.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Reconhecimento de um destinatário
 *
 * Reconhecimentos repetidos do mesmo usuário são registrados, mas contam
 * uma única vez para o limiar.
 */
@Entity
@Table(name = "alert_acknowledgments", indexes = {
    @Index(name = "idx_ack_alert_user", columnList = "alert_pk, user_id")
})
public class AlertAcknowledgment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "alert_pk", nullable = false)
    private Alert alert;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "acknowledged_at", nullable = false)
    private LocalDateTime acknowledgedAt;

    @ElementCollection
    @CollectionTable(name = "acknowledgment_actions", joinColumns = @JoinColumn(name = "acknowledgment_id"))
    @OrderColumn(name = "list_index")
    @Column(name = "action_taken")
    private List<String> actions = new ArrayList<>();

    @Column(name = "comments", length = 1000)
    private String comments;

    @Column(name = "latitude")
    private Double latitude;

    @Column(name = "longitude")
    private Double longitude;

    public AlertAcknowledgment() {}

    public AlertAcknowledgment(String userId, LocalDateTime acknowledgedAt) {
        this.userId = userId;
        this.acknowledgedAt = acknowledgedAt;
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

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public LocalDateTime getAcknowledgedAt() {
        return acknowledgedAt;
    }

    public void setAcknowledgedAt(LocalDateTime acknowledgedAt) {
        this.acknowledgedAt = acknowledgedAt;
    }

    public List<String> getActions() {
        return actions;
    }

    public void setActions(List<String> actions) {
        this.actions = actions;
    }

    public String getComments() {
        return comments;
    }

    public void setComments(String comments) {
        this.comments = comments;
    }

    public Double getLatitude() {
        return latitude;
    }

    public void setLatitude(Double latitude) {
        this.latitude = latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public void setLongitude(Double longitude) {
        this.longitude = longitude;
    }
}
