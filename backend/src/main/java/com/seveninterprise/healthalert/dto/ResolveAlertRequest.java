package com.seveninterprise.healthalert.dto;

import com.seveninterprise.healthalert.model.AlertResolution;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.ArrayList;
import java.util.List;

public class ResolveAlertRequest {

    @Size(max = 1000, message = "Comments cannot exceed 1000 characters")
    private String comments;

    @NotNull(message = "Resolution type is required")
    private AlertResolution.ResolutionType resolutionType;

    private List<String> actionsTaken = new ArrayList<>();

    private boolean followUpRequired;

    public ResolveAlertRequest() {}

    public ResolveAlertRequest(String comments, AlertResolution.ResolutionType resolutionType) {
        this.comments = comments;
        this.resolutionType = resolutionType;
    }

    public String getComments() {
        return comments;
    }

    public void setComments(String comments) {
        this.comments = comments;
    }

    public AlertResolution.ResolutionType getResolutionType() {
        return resolutionType;
    }

    public void setResolutionType(AlertResolution.ResolutionType resolutionType) {
        this.resolutionType = resolutionType;
    }

    public List<String> getActionsTaken() {
        return actionsTaken;
    }

    public void setActionsTaken(List<String> actionsTaken) {
        this.actionsTaken = actionsTaken;
    }

    public boolean isFollowUpRequired() {
        return followUpRequired;
    }

    public void setFollowUpRequired(boolean followUpRequired) {
        this.followUpRequired = followUpRequired;
    }
}
