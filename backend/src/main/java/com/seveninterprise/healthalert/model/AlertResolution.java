package com.seveninterprise.healthalert.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import java.time.LocalDateTime;

/**
 * Dados de resolução do alerta. As ações tomadas ficam em Alert.resolutionActions.
 */
@Embeddable
public class AlertResolution {

    public enum ResolutionStatus {
        PENDING,
        IN_PROGRESS,
        RESOLVED,
        DISMISSED
    }

    public enum ResolutionType {
        SYSTEM_AUTO,            // Resolvido automaticamente
        MANUAL_INTERVENTION,    // Intervenção de operador
        ESCALATION_RESOLVED,    // Resolvido após escalação
        FALSE_ALARM             // Alarme falso
    }

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution_status")
    private ResolutionStatus status = ResolutionStatus.PENDING;

    @Column(name = "resolved_by")
    private String resolvedBy;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Column(name = "resolution_comments", length = 1000)
    private String comments;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution_type")
    private ResolutionType resolutionType;

    @Column(name = "follow_up_required")
    private boolean followUpRequired;

    public ResolutionStatus getStatus() {
        return status;
    }

    public void setStatus(ResolutionStatus status) {
        this.status = status;
    }

    public String getResolvedBy() {
        return resolvedBy;
    }

    public void setResolvedBy(String resolvedBy) {
        this.resolvedBy = resolvedBy;
    }

    public LocalDateTime getResolvedAt() {
        return resolvedAt;
    }

    public void setResolvedAt(LocalDateTime resolvedAt) {
        this.resolvedAt = resolvedAt;
    }

    public String getComments() {
        return comments;
    }

    public void setComments(String comments) {
        this.comments = comments;
    }

    public ResolutionType getResolutionType() {
        return resolutionType;
    }

    public void setResolutionType(ResolutionType resolutionType) {
        this.resolutionType = resolutionType;
    }

    public boolean isFollowUpRequired() {
        return followUpRequired;
    }

    public void setFollowUpRequired(boolean followUpRequired) {
        this.followUpRequired = followUpRequired;
    }
}
