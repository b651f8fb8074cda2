package com.roomsignal.controller;

import com.roomsignal.dto.AnswerRequest;
import com.roomsignal.dto.ChatMessageRequest;
import com.roomsignal.dto.ConnectionQualityRequest;
import com.roomsignal.dto.FileShareRequest;
import com.roomsignal.dto.IceCandidateRequest;
import com.roomsignal.dto.JoinRoomRequest;
import com.roomsignal.dto.MediaToggleRequest;
import com.roomsignal.dto.OfferRequest;
import com.roomsignal.dto.RaiseHandRequest;
import com.roomsignal.dto.ScreenShareRequest;
import com.roomsignal.dto.TargetParticipantRequest;
import com.roomsignal.exception.ErrorType;
import com.roomsignal.model.MediaKind;
import com.roomsignal.service.SignalingDispatcher;
import com.roomsignal.ws.RemoteAddressHandshakeInterceptor;
import com.roomsignal.ws.SessionOrigin;
import org.springframework.messaging.converter.MessageConversionException;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.util.Map;

/**
 * STOMP entry points of the signaling protocol. Each {@code /app/<event>}
 * destination maps to one dispatcher operation.
 */
@Controller
public class WebRTCSignalingController {

    private final SignalingDispatcher dispatcher;

    public WebRTCSignalingController(SignalingDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @MessageMapping("/join-room")
    public void handleJoinRoom(@Payload JoinRoomRequest request, SimpMessageHeaderAccessor accessor) {
        dispatcher.join(origin(accessor), request);
    }

    @MessageMapping("/leave-room")
    public void handleLeaveRoom(SimpMessageHeaderAccessor accessor) {
        dispatcher.leave(origin(accessor));
    }

    @MessageMapping("/offer")
    public void handleOffer(@Payload OfferRequest request, SimpMessageHeaderAccessor accessor) {
        dispatcher.offer(origin(accessor), request);
    }

    @MessageMapping("/answer")
    public void handleAnswer(@Payload AnswerRequest request, SimpMessageHeaderAccessor accessor) {
        dispatcher.answer(origin(accessor), request);
    }

    @MessageMapping("/ice-candidate")
    public void handleIceCandidate(@Payload IceCandidateRequest request, SimpMessageHeaderAccessor accessor) {
        dispatcher.iceCandidate(origin(accessor), request);
    }

    @MessageMapping("/toggle-audio")
    public void handleToggleAudio(@Payload MediaToggleRequest request, SimpMessageHeaderAccessor accessor) {
        dispatcher.toggleMedia(origin(accessor), MediaKind.AUDIO, request);
    }

    @MessageMapping("/toggle-video")
    public void handleToggleVideo(@Payload MediaToggleRequest request, SimpMessageHeaderAccessor accessor) {
        dispatcher.toggleMedia(origin(accessor), MediaKind.VIDEO, request);
    }

    @MessageMapping("/toggle-screen-share")
    public void handleToggleScreenShare(@Payload MediaToggleRequest request, SimpMessageHeaderAccessor accessor) {
        dispatcher.toggleMedia(origin(accessor), MediaKind.SCREEN, request);
    }

    @MessageMapping("/start-screen-share")
    public void handleStartScreenShare(@Payload(required = false) ScreenShareRequest request,
                                       SimpMessageHeaderAccessor accessor) {
        dispatcher.startScreenShare(origin(accessor), request);
    }

    @MessageMapping("/stop-screen-share")
    public void handleStopScreenShare(SimpMessageHeaderAccessor accessor) {
        dispatcher.stopScreenShare(origin(accessor));
    }

    @MessageMapping("/start-recording")
    public void handleStartRecording(SimpMessageHeaderAccessor accessor) {
        dispatcher.startRecording(origin(accessor));
    }

    @MessageMapping("/stop-recording")
    public void handleStopRecording(SimpMessageHeaderAccessor accessor) {
        dispatcher.stopRecording(origin(accessor));
    }

    @MessageMapping("/mute-participant")
    public void handleMuteParticipant(@Payload TargetParticipantRequest request, SimpMessageHeaderAccessor accessor) {
        dispatcher.muteParticipant(origin(accessor), request);
    }

    @MessageMapping("/remove-participant")
    public void handleRemoveParticipant(@Payload TargetParticipantRequest request, SimpMessageHeaderAccessor accessor) {
        dispatcher.removeParticipant(origin(accessor), request);
    }

    @MessageMapping("/raise-hand")
    public void handleRaiseHand(@Payload RaiseHandRequest request, SimpMessageHeaderAccessor accessor) {
        dispatcher.raiseHand(origin(accessor), request);
    }

    @MessageMapping("/send-message")
    public void handleChatMessage(@Payload ChatMessageRequest request, SimpMessageHeaderAccessor accessor) {
        dispatcher.sendMessage(origin(accessor), request);
    }

    @MessageMapping("/share-file")
    public void handleShareFile(@Payload FileShareRequest request, SimpMessageHeaderAccessor accessor) {
        dispatcher.shareFile(origin(accessor), request);
    }

    @MessageMapping("/connection-quality")
    public void handleConnectionQuality(@Payload ConnectionQualityRequest request,
                                        SimpMessageHeaderAccessor accessor) {
        dispatcher.connectionQuality(origin(accessor), request);
    }

    @MessageExceptionHandler(MessageConversionException.class)
    public void handleUnreadablePayload(MessageConversionException e, SimpMessageHeaderAccessor accessor) {
        dispatcher.reportError(origin(accessor), ErrorType.INVALID_PAYLOAD, "Malformed payload");
    }

    static SessionOrigin origin(SimpMessageHeaderAccessor accessor) {
        Principal user = accessor.getUser();
        String sessionId = accessor.getSessionId();
        Map<String, Object> attributes = accessor.getSessionAttributes();
        Object address = attributes != null ? attributes.get(RemoteAddressHandshakeInterceptor.REMOTE_ADDRESS) : null;

        return new SessionOrigin(sessionId,
                user != null ? user.getName() : sessionId,
                address != null ? address.toString() : null);
    }
}
