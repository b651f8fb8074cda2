package com.roomsignal.ws;

import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.net.InetSocketAddress;
import java.util.Map;

/**
 * Copies the client address into the WebSocket session attributes for rate limiting.
 */
public class RemoteAddressHandshakeInterceptor implements HandshakeInterceptor {

    public static final String REMOTE_ADDRESS = "remoteAddress";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        InetSocketAddress address = request.getRemoteAddress();
        if (address != null && address.getAddress() != null) {
            attributes.put(REMOTE_ADDRESS, address.getAddress().getHostAddress());
        }
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
    }
}
