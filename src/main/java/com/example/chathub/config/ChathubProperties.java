package com.example.chathub.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "chathub")
public class ChathubProperties {

    private final Identity identity = new Identity();
    private final Bus bus = new Bus();
    private final History history = new History();
    private final WebSocket websocket = new WebSocket();
    private final Chat chat = new Chat();

    public Identity getIdentity() { return identity; }
    public Bus getBus() { return bus; }
    public History getHistory() { return history; }
    public WebSocket getWebsocket() { return websocket; }
    public Chat getChat() { return chat; }

    public static class Identity {
        private String baseUrl = "http://127.0.0.1:8000";
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration readTimeout = Duration.ofSeconds(5);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public Duration getReadTimeout() { return readTimeout; }
        public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
    }

    public static class Bus {
        private String addChannel = "added_to_group";
        private String removeChannel = "remove_from_group";

        public String getAddChannel() { return addChannel; }
        public void setAddChannel(String addChannel) { this.addChannel = addChannel; }

        public String getRemoveChannel() { return removeChannel; }
        public void setRemoveChannel(String removeChannel) { this.removeChannel = removeChannel; }
    }

    public static class History {
        private int defaultLimit = 100;
        private int maxLimit = 100;

        public int getDefaultLimit() { return defaultLimit; }
        public void setDefaultLimit(int defaultLimit) { this.defaultLimit = defaultLimit; }

        public int getMaxLimit() { return maxLimit; }
        public void setMaxLimit(int maxLimit) { this.maxLimit = maxLimit; }
    }

    public static class WebSocket {
        private String path = "/ws/group/{groupId}";
        private String allowedOrigins = "*";
        private int maxTextMessageBufferSize = 64 * 1024;
        private Duration sendTimeLimit = Duration.ofSeconds(10);
        private int sendBufferSizeLimit = 512 * 1024;

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public String getAllowedOrigins() { return allowedOrigins; }
        public void setAllowedOrigins(String allowedOrigins) { this.allowedOrigins = allowedOrigins; }

        public int getMaxTextMessageBufferSize() { return maxTextMessageBufferSize; }
        public void setMaxTextMessageBufferSize(int maxTextMessageBufferSize) { this.maxTextMessageBufferSize = maxTextMessageBufferSize; }

        public Duration getSendTimeLimit() { return sendTimeLimit; }
        public void setSendTimeLimit(Duration sendTimeLimit) { this.sendTimeLimit = sendTimeLimit; }

        public int getSendBufferSizeLimit() { return sendBufferSizeLimit; }
        public void setSendBufferSizeLimit(int sendBufferSizeLimit) { this.sendBufferSizeLimit = sendBufferSizeLimit; }
    }

    public static class Chat {
        private MalformedFramePolicy malformedFramePolicy = MalformedFramePolicy.SKIP;
        private boolean notifySenderOnPersistenceFailure = true;

        public MalformedFramePolicy getMalformedFramePolicy() { return malformedFramePolicy; }
        public void setMalformedFramePolicy(MalformedFramePolicy malformedFramePolicy) { this.malformedFramePolicy = malformedFramePolicy; }

        public boolean isNotifySenderOnPersistenceFailure() { return notifySenderOnPersistenceFailure; }
        public void setNotifySenderOnPersistenceFailure(boolean notifySenderOnPersistenceFailure) { this.notifySenderOnPersistenceFailure = notifySenderOnPersistenceFailure; }
    }

    /**
     * What a session does with an inbound frame that cannot be decoded.
     */
    public enum MalformedFramePolicy {
        /** Log and drop the single frame; the connection stays open. */
        SKIP,
        /** Close the connection with BAD_DATA. */
        CLOSE
    }
}
