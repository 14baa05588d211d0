package com.seveninterprise.healthalert.dto;

import jakarta.validation.constraints.Size;

import java.util.ArrayList;
import java.util.List;

public class AcknowledgeAlertRequest {

    private List<String> actions = new ArrayList<>();

    @Size(max = 1000, message = "Comments cannot exceed 1000 characters")
    private String comments;

    private Double latitude;
    private Double longitude;

    public AcknowledgeAlertRequest() {}

    public AcknowledgeAlertRequest(List<String> actions, String comments) {
        this.actions = actions;
        this.comments = comments;
    }

    public List<String> getActions() {
        return actions;
    }

    public void setActions(List<String> actions) {
        this.actions = actions;
    }

    public String getComments() {
        return comments;
    }

    public void setComments(String comments) {
        this.comments = comments;
    }

    public Double getLatitude() {
        return latitude;
    }

    public void setLatitude(Double latitude) {
        this.latitude = latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public void setLongitude(Double longitude) {
        this.longitude = longitude;
    }
}
