package com.roomsignal.dto;

public class OfferRequest {
    private String target;
    private Object offer;

    public OfferRequest() {}

    public OfferRequest(String target, Object offer) {
        this.target = target;
        this.offer = offer;
    }

    public String getTarget() { return target; }
    public void setTarget(String target) { this.target = target; }

    public Object getOffer() { return offer; }
    public void setOffer(Object offer) { this.offer = offer; }
}
