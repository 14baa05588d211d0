package com.seveninterprise.healthalert.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Contadores agregados de entrega
 *
 * Sempre recalculados a partir do estado completo destinatário × canal
 * (Alert.recomputeDeliveryStatistics), nunca incrementados.
 */
@Embeddable
public class DeliveryStatistics {

    @Column(name = "total_recipients", nullable = false)
    private int totalRecipients;

    @Column(name = "sent_count", nullable = false)
    private int sent;

    @Column(name = "delivered_count", nullable = false)
    private int delivered;

    @Column(name = "read_count", nullable = false)
    private int read;

    @Column(name = "failed_count", nullable = false)
    private int failed;

    public int getTotalRecipients() {
        return totalRecipients;
    }

    public void setTotalRecipients(int totalRecipients) {
        this.totalRecipients = totalRecipients;
    }

    public int getSent() {
        return sent;
    }

    public void setSent(int sent) {
        this.sent = sent;
    }

    public int getDelivered() {
        return delivered;
    }

    public void setDelivered(int delivered) {
        this.delivered = delivered;
    }

    public int getRead() {
        return read;
    }

    public void setRead(int read) {
        this.read = read;
    }

    public int getFailed() {
        return failed;
    }

    public void setFailed(int failed) {
        this.failed = failed;
    }
}
