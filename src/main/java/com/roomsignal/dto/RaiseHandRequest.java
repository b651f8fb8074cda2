package com.roomsignal.dto;

public class RaiseHandRequest {
    private Boolean raised;

    public RaiseHandRequest() {}

    public RaiseHandRequest(Boolean raised) {
        this.raised = raised;
    }

    public Boolean getRaised() { return raised; }
    public void setRaised(Boolean raised) { this.raised = raised; }
}
