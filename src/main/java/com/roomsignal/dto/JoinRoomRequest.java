package com.roomsignal.dto;

public class JoinRoomRequest {
    private String roomId;
    private String userName;
    private String password;

    public JoinRoomRequest() {}

    public JoinRoomRequest(String roomId, String userName, String password) {
        this.roomId = roomId;
        this.userName = userName;
        this.password = password;
    }

    public String getRoomId() { return roomId; }
    public void setRoomId(String roomId) { this.roomId = roomId; }

    public String getUserName() { return userName; }
    public void setUserName(String userName) { this.userName = userName; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
}
