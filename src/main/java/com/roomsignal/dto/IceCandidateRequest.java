package com.roomsignal.dto;

public class IceCandidateRequest {
    private String target;
    private Object candidate;

    public IceCandidateRequest() {}

    public IceCandidateRequest(String target, Object candidate) {
        this.target = target;
        this.candidate = candidate;
    }

    public String getTarget() { return target; }
    public void setTarget(String target) { this.target = target; }

    public Object getCandidate() { return candidate; }
    public void setCandidate(Object candidate) { this.candidate = candidate; }
}
