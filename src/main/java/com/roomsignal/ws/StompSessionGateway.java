package com.roomsignal.ws;

import com.roomsignal.dto.SignalEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Component;

/**
 * Delivers events to {@code /user/queue/signal} of the participant's connection.
 */
@Component
public class StompSessionGateway implements SessionGateway {
    private static final Logger log = LoggerFactory.getLogger(StompSessionGateway.class);

    public static final String SIGNAL_QUEUE = "/queue/signal";

    private final SimpMessagingTemplate messagingTemplate;
    private final MessageChannel clientInboundChannel;

    public StompSessionGateway(SimpMessagingTemplate messagingTemplate,
                               @Qualifier("clientInboundChannel") MessageChannel clientInboundChannel) {
        this.messagingTemplate = messagingTemplate;
        this.clientInboundChannel = clientInboundChannel;
    }

    @Override
    public void send(String participantId, SignalEvent event) {
        try {
            messagingTemplate.convertAndSendToUser(participantId, SIGNAL_QUEUE, event);
        } catch (MessagingException e) {
            log.warn("Failed to deliver {} to {}", event, participantId, e);
        }
    }

    /**
     * Feeds a DISCONNECT frame for the session into the inbound channel, which
     * closes it as if the client had sent it.
     */
    @Override
    public void disconnect(String sessionHandle) {
        try {
            StompHeaderAccessor header = StompHeaderAccessor.create(StompCommand.DISCONNECT);
            header.setSessionId(sessionHandle);
            header.setLeaveMutable(true);
            clientInboundChannel.send(MessageBuilder.createMessage(new byte[0], header.getMessageHeaders()));
        } catch (MessagingException e) {
            log.warn("Failed to force disconnect of session {}", sessionHandle, e);
        }
    }
}
