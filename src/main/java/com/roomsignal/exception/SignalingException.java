package com.roomsignal.exception;

/**
 * Recoverable failure of a room or signaling operation. The dispatcher turns it
 * into an error event for the originating session; the HTTP layer into a status code.
 */
public class SignalingException extends RuntimeException {

    private final ErrorType type;

    public SignalingException(ErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public ErrorType getType() { return type; }

    public static SignalingException roomNotFound(String roomId) {
        return new SignalingException(ErrorType.ROOM_NOT_FOUND, "Room not found: " + roomId);
    }

    public static SignalingException notInRoom() {
        return new SignalingException(ErrorType.NOT_IN_ROOM, "User not in room");
    }

    public static SignalingException permissionDenied(String message) {
        return new SignalingException(ErrorType.PERMISSION_DENIED, message);
    }

    public static SignalingException invalidPayload(String message) {
        return new SignalingException(ErrorType.INVALID_PAYLOAD, message);
    }
}
