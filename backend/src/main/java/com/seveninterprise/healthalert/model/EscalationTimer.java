package com.seveninterprise.healthalert.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * Timer de escalação
 *
 * Indexado por (active, trigger_time) para a varredura encontrar os vencidos.
 * Uma vez inativo nunca volta a ser ativado.
 */
@Entity
@Table(name = "escalation_timers", indexes = {
    @Index(name = "idx_timers_due", columnList = "active, trigger_time")
})
public class EscalationTimer {

    public static final String INITIAL_ESCALATION = "initial_escalation";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "alert_pk", nullable = false)
    private Alert alert;

    @Column(name = "timer_name", nullable = false)
    private String name;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "trigger_time", nullable = false)
    private LocalDateTime triggerTime;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false)
    private EscalationRule.EscalationAction action;

    @Column(name = "fired_at")
    private LocalDateTime firedAt;

    public EscalationTimer() {}

    public EscalationTimer(String name, LocalDateTime startTime, LocalDateTime triggerTime,
                           EscalationRule.EscalationAction action) {
        this.name = name;
        this.startTime = startTime;
        this.triggerTime = triggerTime;
        this.action = action;
    }

    public boolean isDue(LocalDateTime now) {
        return active && !triggerTime.isAfter(now);
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

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public LocalDateTime getStartTime() {
        return startTime;
    }

    public void setStartTime(LocalDateTime startTime) {
        this.startTime = startTime;
    }

    public LocalDateTime getTriggerTime() {
        return triggerTime;
    }

    public void setTriggerTime(LocalDateTime triggerTime) {
        this.triggerTime = triggerTime;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public EscalationRule.EscalationAction getAction() {
        return action;
    }

    public void setAction(EscalationRule.EscalationAction action) {
        this.action = action;
    }

    public LocalDateTime getFiredAt() {
        return firedAt;
    }

    public void setFiredAt(LocalDateTime firedAt) {
        this.firedAt = firedAt;
    }
}
