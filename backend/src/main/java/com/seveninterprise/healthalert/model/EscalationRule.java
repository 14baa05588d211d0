package com.seveninterprise.healthalert.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import java.util.ArrayList;
import java.util.List;

/**
 * Regra de escalação configurada na criação do alerta
 *
 * threshold depende da condição:
 * - TIME_BASED: horas até o disparo
 * - ACKNOWLEDGMENT_BASED: percentual mínimo de reconhecimento
 * - SEVERITY_BASED: índice mínimo do nível (INFO=0 ... EMERGENCY=3)
 * - DELIVERY_FAILURE: percentual de falhas no lote
 */
@Entity
@Table(name = "escalation_rules")
public class EscalationRule {

    public enum EscalationCondition {
        TIME_BASED,
        ACKNOWLEDGMENT_BASED,
        SEVERITY_BASED,
        DELIVERY_FAILURE
    }

    public enum EscalationAction {
        ESCALATE_TO_SUPERVISOR,     // Padrão: novos destinatários + prioridade +1
        INCREASE_ALERT_LEVEL,       // Também sobe o nível do alerta
        ADD_RECIPIENTS,             // Apenas adiciona destinatários
        CHANGE_DELIVERY_METHOD      // Adiciona SMS e chamada de voz
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "alert_pk", nullable = false)
    private Alert alert;

    @Enumerated(EnumType.STRING)
    @Column(name = "escalation_condition", nullable = false)
    private EscalationCondition condition;

    @Column(name = "threshold_value")
    private Integer threshold;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false)
    private EscalationAction action;

    @ElementCollection
    @CollectionTable(name = "escalation_rule_targets", joinColumns = @JoinColumn(name = "rule_id"))
    @OrderColumn(name = "list_index")
    @Column(name = "user_id")
    private List<String> escalateTo = new ArrayList<>();

    @Column(name = "fired", nullable = false)
    private boolean fired;

    public EscalationRule() {}

    public EscalationRule(EscalationCondition condition, Integer threshold, EscalationAction action, List<String> escalateTo) {
        this.condition = condition;
        this.threshold = threshold;
        this.action = action;
        this.escalateTo = escalateTo != null ? new ArrayList<>(escalateTo) : new ArrayList<>();
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

    public EscalationCondition getCondition() {
        return condition;
    }

    public void setCondition(EscalationCondition condition) {
        this.condition = condition;
    }

    public Integer getThreshold() {
        return threshold;
    }

    public void setThreshold(Integer threshold) {
        this.threshold = threshold;
    }

    public EscalationAction getAction() {
        return action;
    }

    public void setAction(EscalationAction action) {
        this.action = action;
    }

    public List<String> getEscalateTo() {
        return escalateTo;
    }

    public void setEscalateTo(List<String> escalateTo) {
        this.escalateTo = escalateTo;
    }

    public boolean isFired() {
        return fired;
    }

    public void setFired(boolean fired) {
        this.fired = fired;
    }
}
