package com.roomsignal.exception;

import org.springframework.http.HttpStatus;

/**
 * Error vocabulary shared by the signaling channel and the HTTP surface.
 * The tag is what clients see in the {@code type} field of an error event.
 */
public enum ErrorType {
    ROOM_NOT_FOUND("room-not-found", HttpStatus.NOT_FOUND),
    ROOM_INACTIVE("room-inactive", HttpStatus.CONFLICT),
    ROOM_FULL("room-full", HttpStatus.CONFLICT),
    INVALID_PASSWORD("invalid-password", HttpStatus.FORBIDDEN),
    DUPLICATE_PARTICIPANT("duplicate-participant", HttpStatus.CONFLICT),
    NOT_IN_ROOM("not-in-room", HttpStatus.CONFLICT),
    PERMISSION_DENIED("permission-denied", HttpStatus.FORBIDDEN),
    RATE_LIMITED("rate-limited", HttpStatus.TOO_MANY_REQUESTS),
    INVALID_PAYLOAD("invalid-payload", HttpStatus.BAD_REQUEST),
    TARGET_NOT_FOUND("target-not-found", HttpStatus.NOT_FOUND),
    OFFER_FAILED("offer-failed", HttpStatus.CONFLICT),
    ANSWER_FAILED("answer-failed", HttpStatus.CONFLICT),
    INTERNAL_ERROR("internal-error", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String tag;
    private final HttpStatus httpStatus;

    ErrorType(String tag, HttpStatus httpStatus) {
        this.tag = tag;
        this.httpStatus = httpStatus;
    }

    public String getTag() { return tag; }

    public HttpStatus getHttpStatus() { return httpStatus; }
}
