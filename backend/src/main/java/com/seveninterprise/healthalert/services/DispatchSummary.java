package com.seveninterprise.healthalert.services;

/**
 * Resumo de um lote de entrega
 */
public class DispatchSummary {

    private final String alertId;
    private int attempted;
    private int sent;
    private int failed;
    private int held;
    private int escalations;

    public DispatchSummary(String alertId) {
        this.alertId = alertId;
    }

    public static DispatchSummary empty(String alertId) {
        return new DispatchSummary(alertId);
    }

    void recordSent() {
        attempted++;
        sent++;
    }

    void recordFailed() {
        attempted++;
        failed++;
    }

    void recordHeld() {
        held++;
    }

    void recordEscalations(int count) {
        escalations += count;
    }

    public String getAlertId() {
        return alertId;
    }

    public int getAttempted() {
        return attempted;
    }

    public int getSent() {
        return sent;
    }

    public int getFailed() {
        return failed;
    }

    public int getHeld() {
        return held;
    }

    public int getEscalations() {
        return escalations;
    }
}
