package com.roomsignal.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * One ICE server descriptor as browsers expect it in {@code RTCConfiguration.iceServers}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IceServer {
    private List<String> urls = new ArrayList<>();
    private String username;
    private String credential;

    public IceServer() {}

    public IceServer(String url) {
        this.urls.add(url);
    }

    public List<String> getUrls() { return urls; }
    public void setUrls(List<String> urls) { this.urls = urls; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getCredential() { return credential; }
    public void setCredential(String credential) { this.credential = credential; }
}
