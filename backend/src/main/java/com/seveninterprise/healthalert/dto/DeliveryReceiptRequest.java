package com.seveninterprise.healthalert.dto;

import com.seveninterprise.healthalert.model.Alert;
import com.seveninterprise.healthalert.model.RecipientDeliveryStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Confirmação assíncrona do gateway (DELIVERED, READ ou FAILED)
 */
public class DeliveryReceiptRequest {

    @NotBlank(message = "User id is required")
    private String userId;

    @NotNull(message = "Channel is required")
    private Alert.DeliveryChannel channel;

    @NotNull(message = "Delivery state is required")
    private RecipientDeliveryStatus.DeliveryState state;

    private String errorMessage;

    public DeliveryReceiptRequest() {}

    public DeliveryReceiptRequest(String userId, Alert.DeliveryChannel channel,
                                  RecipientDeliveryStatus.DeliveryState state, String errorMessage) {
        this.userId = userId;
        this.channel = channel;
        this.state = state;
        this.errorMessage = errorMessage;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public Alert.DeliveryChannel getChannel() {
        return channel;
    }

    public void setChannel(Alert.DeliveryChannel channel) {
        this.channel = channel;
    }

    public RecipientDeliveryStatus.DeliveryState getState() {
        return state;
    }

    public void setState(RecipientDeliveryStatus.DeliveryState state) {
        this.state = state;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }
}
