package com.seveninterprise.healthalert.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Registro append-only de uma tentativa de entrega em um canal
 */
@Entity
@Table(name = "delivery_attempts")
public class DeliveryAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "alert_pk", nullable = false)
    private Alert alert;

    @Column(name = "attempt_number", nullable = false)
    private int attemptNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "channel", nullable = false)
    private Alert.DeliveryChannel channel;

    @Column(name = "attempted_at", nullable = false)
    private LocalDateTime attemptedAt;

    @Column(name = "recipients_attempted", nullable = false)
    private int recipientsAttempted;

    @Column(name = "success_count", nullable = false)
    private int successCount;

    @Column(name = "failure_count", nullable = false)
    private int failureCount;

    @ElementCollection
    @CollectionTable(name = "delivery_attempt_errors", joinColumns = @JoinColumn(name = "attempt_id"))
    @OrderColumn(name = "list_index")
    @Column(name = "error_message", length = 500)
    private List<String> errors = new ArrayList<>();

    public DeliveryAttempt() {}

    public DeliveryAttempt(int attemptNumber, Alert.DeliveryChannel channel, LocalDateTime attemptedAt) {
        this.attemptNumber = attemptNumber;
        this.channel = channel;
        this.attemptedAt = attemptedAt;
    }

    public void recordSuccess() {
        recipientsAttempted++;
        successCount++;
    }

    public void recordFailure(String error) {
        recipientsAttempted++;
        failureCount++;
        errors.add(error);
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

    public int getAttemptNumber() {
        return attemptNumber;
    }

    public void setAttemptNumber(int attemptNumber) {
        this.attemptNumber = attemptNumber;
    }

    public Alert.DeliveryChannel getChannel() {
        return channel;
    }

    public void setChannel(Alert.DeliveryChannel channel) {
        this.channel = channel;
    }

    public LocalDateTime getAttemptedAt() {
        return attemptedAt;
    }

    public void setAttemptedAt(LocalDateTime attemptedAt) {
        this.attemptedAt = attemptedAt;
    }

    public int getRecipientsAttempted() {
        return recipientsAttempted;
    }

    public void setRecipientsAttempted(int recipientsAttempted) {
        this.recipientsAttempted = recipientsAttempted;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public void setSuccessCount(int successCount) {
        this.successCount = successCount;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public void setFailureCount(int failureCount) {
        this.failureCount = failureCount;
    }

    public List<String> getErrors() {
        return errors;
    }

    public void setErrors(List<String> errors) {
        this.errors = errors;
    }
}
