package com.roomsignal.dto;

import javax.validation.Valid;
import javax.validation.constraints.AssertTrue;
import javax.validation.constraints.Size;

public class CreateRoomRequest {

    @Size(max = 100, message = "Invalid createdBy field. Must be a string with max 100 characters.")
    private String createdBy;

    @Valid
    private RoomSettingsRequest settings;

    public CreateRoomRequest() {}

    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }

    public RoomSettingsRequest getSettings() { return settings; }
    public void setSettings(RoomSettingsRequest settings) { this.settings = settings; }

    @AssertTrue(message = "A password is required when requirePassword is set.")
    public boolean isPasswordConsistent() {
        return settings == null
                || !Boolean.TRUE.equals(settings.getRequirePassword())
                || (settings.getPassword() != null && !settings.getPassword().isEmpty());
    }
}
