package com.seveninterprise.healthalert.services;

/**
 * Resultado de um envio: aceito pelo gateway ou falha com mensagem
 */
public final class ChannelSendResult {

    private final boolean accepted;
    private final String error;

    private ChannelSendResult(boolean accepted, String error) {
        this.accepted = accepted;
        this.error = error;
    }

    public static ChannelSendResult accepted() {
        return new ChannelSendResult(true, null);
    }

    public static ChannelSendResult failed(String error) {
        return new ChannelSendResult(false, error != null ? error : "Falha desconhecida no envio");
    }

    public boolean isAccepted() {
        return accepted;
    }

    public String getError() {
        return error;
    }
}
