package com.seveninterprise.healthalert.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Entrada append-only da cadeia de escalação. O nível é a posição na cadeia (1..n).
 */
@Entity
@Table(name = "escalation_chain",
       uniqueConstraints = @UniqueConstraint(name = "uk_chain_level", columnNames = {"alert_pk", "escalation_level"}))
public class EscalationChainEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "alert_pk", nullable = false)
    private Alert alert;

    @Column(name = "escalation_level", nullable = false, updatable = false)
    private int escalationLevel;

    @ElementCollection
    @CollectionTable(name = "escalation_chain_recipients", joinColumns = @JoinColumn(name = "chain_entry_id"))
    @OrderColumn(name = "list_index")
    @Column(name = "user_id")
    private List<String> recipients = new ArrayList<>();

    @Column(name = "escalated_at", nullable = false, updatable = false)
    private LocalDateTime escalatedAt;

    @Column(name = "escalated_by")
    private String escalatedBy;

    @Column(name = "reason", length = 500)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false)
    private EscalationRule.EscalationAction action;

    public EscalationChainEntry() {}

    public EscalationChainEntry(int escalationLevel, List<String> recipients, LocalDateTime escalatedAt,
                                String escalatedBy, String reason, EscalationRule.EscalationAction action) {
        this.escalationLevel = escalationLevel;
        this.recipients = new ArrayList<>(recipients);
        this.escalatedAt = escalatedAt;
        this.escalatedBy = escalatedBy;
        this.reason = reason;
        this.action = action;
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

    public int getEscalationLevel() {
        return escalationLevel;
    }

    public void setEscalationLevel(int escalationLevel) {
        this.escalationLevel = escalationLevel;
    }

    public List<String> getRecipients() {
        return recipients;
    }

    public void setRecipients(List<String> recipients) {
        this.recipients = recipients;
    }

    public LocalDateTime getEscalatedAt() {
        return escalatedAt;
    }

    public void setEscalatedAt(LocalDateTime escalatedAt) {
        this.escalatedAt = escalatedAt;
    }

    public String getEscalatedBy() {
        return escalatedBy;
    }

    public void setEscalatedBy(String escalatedBy) {
        this.escalatedBy = escalatedBy;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public EscalationRule.EscalationAction getAction() {
        return action;
    }

    public void setAction(EscalationRule.EscalationAction action) {
        this.action = action;
    }
}
