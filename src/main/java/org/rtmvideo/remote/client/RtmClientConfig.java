package org.rtmvideo.remote.client;

public class RtmClientConfig {
    private String endpoint = "localhost";
    private int port = 443;
    private String appKey;
    private long clientId;
    private boolean secure = true;

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getAppKey() {
        return appKey;
    }

    public void setAppKey(String appKey) {
        this.appKey = appKey;
    }

    public long getClientId() {
        return clientId;
    }

    public void setClientId(long clientId) {
        this.clientId = clientId;
    }

    public boolean isSecure() {
        return secure;
    }

    public void setSecure(boolean secure) {
        this.secure = secure;
    }

    public RtmClientConfig copy() {
        RtmClientConfig copy = new RtmClientConfig();
        copy.endpoint = endpoint;
        copy.port = port;
        copy.appKey = appKey;
        copy.clientId = clientId;
        copy.secure = secure;
        return copy;
    }

    @Override
    public String toString() {
        return (secure ? "wss://" : "ws://") + endpoint + ":" + port + " (client " + clientId + ")";
    }
}
