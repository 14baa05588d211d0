package com.seveninterprise.healthalert.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Destinatário de um alerta com preferências e status de entrega por canal
 *
 * A lista de canais define os pares (destinatário, canal) que o dispatcher
 * tenta entregar; o canal preferido, quando presente, é enviado primeiro.
 */
@Entity
@Table(name = "alert_recipients",
       uniqueConstraints = @UniqueConstraint(name = "uk_alert_recipient", columnNames = {"alert_pk", "user_id"}))
public class AlertRecipient {

    public enum DeliveryFrequency {
        IMMEDIATE,      // Envio assim que o alerta é criado
        BATCHED,        // Agrupado pela varredura de entrega
        DAILY_SUMMARY   // Resumo diário
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "alert_pk", nullable = false)
    private Alert alert;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @ElementCollection
    @CollectionTable(name = "alert_recipient_channels", joinColumns = @JoinColumn(name = "recipient_id"))
    @OrderColumn(name = "list_index")
    @Enumerated(EnumType.STRING)
    @Column(name = "channel")
    private List<Alert.DeliveryChannel> channels = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "preferred_channel")
    private Alert.DeliveryChannel preferredChannel;

    @Column(name = "dnd_enabled", nullable = false)
    private boolean doNotDisturbEnabled;

    @Column(name = "dnd_start_time")
    private LocalTime doNotDisturbStart;

    @Column(name = "dnd_end_time")
    private LocalTime doNotDisturbEnd;

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_frequency", nullable = false)
    private DeliveryFrequency frequency = DeliveryFrequency.IMMEDIATE;

    @Column(name = "escalation_level", nullable = false)
    private int escalationLevel;

    @Column(name = "added_at", nullable = false)
    private LocalDateTime addedAt;

    @OneToMany(mappedBy = "recipient", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<RecipientDeliveryStatus> deliveryStatuses = new ArrayList<>();

    public AlertRecipient() {}

    public AlertRecipient(String userId, List<Alert.DeliveryChannel> channels, LocalDateTime addedAt) {
        this.userId = userId;
        this.channels = new ArrayList<>(channels);
        this.addedAt = addedAt;
    }

    /**
     * Canais na ordem de envio: preferido primeiro, depois os demais
     */
    public List<Alert.DeliveryChannel> orderedChannels() {
        List<Alert.DeliveryChannel> ordered = new ArrayList<>();
        if (preferredChannel != null && channels.contains(preferredChannel)) {
            ordered.add(preferredChannel);
        }
        for (Alert.DeliveryChannel channel : channels) {
            if (!ordered.contains(channel)) {
                ordered.add(channel);
            }
        }
        return ordered;
    }

    /**
     * Adiciona o canal se ainda não configurado. Retorna true quando foi adicionado.
     */
    public boolean addChannel(Alert.DeliveryChannel channel) {
        if (channels.contains(channel)) {
            return false;
        }
        channels.add(channel);
        return true;
    }

    public Optional<RecipientDeliveryStatus> findDeliveryStatus(Alert.DeliveryChannel channel) {
        return deliveryStatuses.stream()
            .filter(s -> s.getChannel() == channel)
            .findFirst();
    }

    /**
     * Status do canal, criando a linha como PENDING se ainda não existir
     */
    public RecipientDeliveryStatus deliveryStatusFor(Alert.DeliveryChannel channel, LocalDateTime now) {
        return findDeliveryStatus(channel).orElseGet(() -> {
            RecipientDeliveryStatus status = new RecipientDeliveryStatus(channel, RecipientDeliveryStatus.DeliveryState.PENDING, now);
            status.setRecipient(this);
            deliveryStatuses.add(status);
            return status;
        });
    }

    /**
     * Cria os status PENDING dos canais que ainda não têm status. Para
     * resumo diário, os novos pares ficam retidos até dailySummaryAt.
     */
    public void queueDeliveries(LocalDateTime now, LocalDateTime dailySummaryAt) {
        for (Alert.DeliveryChannel channel : channels) {
            if (findDeliveryStatus(channel).isPresent()) {
                continue;
            }
            RecipientDeliveryStatus status = deliveryStatusFor(channel, now);
            if (frequency == DeliveryFrequency.DAILY_SUMMARY) {
                status.setHeldUntil(dailySummaryAt);
            }
        }
    }

    /**
     * Verifica se o horário local está dentro da janela de não perturbe.
     * Janelas que cruzam a meia-noite (ex: 22:00-06:00) são suportadas.
     */
    public boolean isWithinDoNotDisturb(LocalTime localTime) {
        if (!doNotDisturbEnabled || doNotDisturbStart == null || doNotDisturbEnd == null
                || doNotDisturbStart.equals(doNotDisturbEnd)) {
            return false;
        }
        if (doNotDisturbStart.isBefore(doNotDisturbEnd)) {
            return !localTime.isBefore(doNotDisturbStart) && localTime.isBefore(doNotDisturbEnd);
        }
        return !localTime.isBefore(doNotDisturbStart) || localTime.isBefore(doNotDisturbEnd);
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

    public List<Alert.DeliveryChannel> getChannels() {
        return channels;
    }

    public void setChannels(List<Alert.DeliveryChannel> channels) {
        this.channels = channels;
    }

    public Alert.DeliveryChannel getPreferredChannel() {
        return preferredChannel;
    }

    public void setPreferredChannel(Alert.DeliveryChannel preferredChannel) {
        this.preferredChannel = preferredChannel;
    }

    public boolean isDoNotDisturbEnabled() {
        return doNotDisturbEnabled;
    }

    public void setDoNotDisturbEnabled(boolean doNotDisturbEnabled) {
        this.doNotDisturbEnabled = doNotDisturbEnabled;
    }

    public LocalTime getDoNotDisturbStart() {
        return doNotDisturbStart;
    }

    public void setDoNotDisturbStart(LocalTime doNotDisturbStart) {
        this.doNotDisturbStart = doNotDisturbStart;
    }

    public LocalTime getDoNotDisturbEnd() {
        return doNotDisturbEnd;
    }

    public void setDoNotDisturbEnd(LocalTime doNotDisturbEnd) {
        this.doNotDisturbEnd = doNotDisturbEnd;
    }

    public DeliveryFrequency getFrequency() {
        return frequency;
    }

    public void setFrequency(DeliveryFrequency frequency) {
        this.frequency = frequency;
    }

    public int getEscalationLevel() {
        return escalationLevel;
    }

    public void setEscalationLevel(int escalationLevel) {
        this.escalationLevel = escalationLevel;
    }

    public LocalDateTime getAddedAt() {
        return addedAt;
    }

    public void setAddedAt(LocalDateTime addedAt) {
        this.addedAt = addedAt;
    }

    public List<RecipientDeliveryStatus> getDeliveryStatuses() {
        return deliveryStatuses;
    }

    public void setDeliveryStatuses(List<RecipientDeliveryStatus> deliveryStatuses) {
        this.deliveryStatuses = deliveryStatuses;
    }
}
