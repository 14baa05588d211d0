package com.seveninterprise.healthalert.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * Status de entrega de um canal para um destinatário
 *
 * Uma linha por (destinatário, canal); cada envio sobrescreve a anterior.
 * heldUntil marca entregas retidas pela janela de não perturbe e
 * claimedAt marca entregas em andamento (reivindicadas por um envio).
 */
@Entity
@Table(name = "recipient_delivery_status",
       uniqueConstraints = @UniqueConstraint(name = "uk_recipient_channel", columnNames = {"recipient_id", "channel"}))
public class RecipientDeliveryStatus {

    public enum DeliveryState {
        PENDING,    // Ainda não enviado (ou retido)
        SENT,       // Aceito pelo gateway
        DELIVERED,  // Confirmado pelo gateway
        READ,       // Lido pelo destinatário
        FAILED      // Falha ou timeout no envio
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "recipient_id", nullable = false)
    private AlertRecipient recipient;

    @Enumerated(EnumType.STRING)
    @Column(name = "channel", nullable = false)
    private Alert.DeliveryChannel channel;

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_state", nullable = false)
    private DeliveryState state = DeliveryState.PENDING;

    @Column(name = "status_at")
    private LocalDateTime statusAt;

    @Column(name = "error_message", length = 500)
    private String errorMessage;

    @Column(name = "held_until")
    private LocalDateTime heldUntil;

    @Column(name = "claimed_at")
    private LocalDateTime claimedAt;

    public RecipientDeliveryStatus() {}

    public RecipientDeliveryStatus(Alert.DeliveryChannel channel, DeliveryState state, LocalDateTime statusAt) {
        this.channel = channel;
        this.state = state;
        this.statusAt = statusAt;
    }

    public boolean isPending() {
        return state == DeliveryState.PENDING;
    }

    /**
     * Pendente, fora da retenção e sem reivindicação válida
     */
    public boolean isDispatchable(LocalDateTime now, LocalDateTime staleClaimBefore) {
        if (state != DeliveryState.PENDING) {
            return false;
        }
        if (heldUntil != null && heldUntil.isAfter(now)) {
            return false;
        }
        return claimedAt == null || claimedAt.isBefore(staleClaimBefore);
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public AlertRecipient getRecipient() {
        return recipient;
    }

    public void setRecipient(AlertRecipient recipient) {
        this.recipient = recipient;
    }

    public Alert.DeliveryChannel getChannel() {
        return channel;
    }

    public void setChannel(Alert.DeliveryChannel channel) {
        this.channel = channel;
    }

    public DeliveryState getState() {
        return state;
    }

    public void setState(DeliveryState state) {
        this.state = state;
    }

    public LocalDateTime getStatusAt() {
        return statusAt;
    }

    public void setStatusAt(LocalDateTime statusAt) {
        this.statusAt = statusAt;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public LocalDateTime getHeldUntil() {
        return heldUntil;
    }

    public void setHeldUntil(LocalDateTime heldUntil) {
        this.heldUntil = heldUntil;
    }

    public LocalDateTime getClaimedAt() {
        return claimedAt;
    }

    public void setClaimedAt(LocalDateTime claimedAt) {
        this.claimedAt = claimedAt;
    }
}
