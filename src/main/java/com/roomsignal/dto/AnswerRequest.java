package com.roomsignal.dto;

public class AnswerRequest {
    private String target;
    private Object answer;

    public AnswerRequest() {}

    public AnswerRequest(String target, Object answer) {
        this.target = target;
        this.answer = answer;
    }

    public String getTarget() { return target; }
    public void setTarget(String target) { this.target = target; }

    public Object getAnswer() { return answer; }
    public void setAnswer(Object answer) { this.answer = answer; }
}
