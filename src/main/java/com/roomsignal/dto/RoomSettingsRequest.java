package com.roomsignal.dto;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.Size;

public class RoomSettingsRequest {

    @Min(value = 1, message = "maxUsers must be a number between 1 and 50.")
    @Max(value = 50, message = "maxUsers must be a number between 1 and 50.")
    private Integer maxUsers;

    private Boolean requirePassword;

    @Size(max = 50, message = "Password must be a string with max 50 characters.")
    private String password;

    private Boolean allowScreenShare;

    private Boolean allowChat;

    public RoomSettingsRequest() {}

    public Integer getMaxUsers() { return maxUsers; }
    public void setMaxUsers(Integer maxUsers) { this.maxUsers = maxUsers; }

    public Boolean getRequirePassword() { return requirePassword; }
    public void setRequirePassword(Boolean requirePassword) { this.requirePassword = requirePassword; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public Boolean getAllowScreenShare() { return allowScreenShare; }
    public void setAllowScreenShare(Boolean allowScreenShare) { this.allowScreenShare = allowScreenShare; }

    public Boolean getAllowChat() { return allowChat; }
    public void setAllowChat(Boolean allowChat) { this.allowChat = allowChat; }
}
