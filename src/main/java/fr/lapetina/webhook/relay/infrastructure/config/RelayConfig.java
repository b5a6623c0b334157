package fr.lapetina.webhook.relay.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the webhook relay.
 * Designed to be populated from YAML, then overridden from the environment.
 */
public class RelayConfig {

    private ServerConfig server = new ServerConfig();
    private PubSubConfig pubsub = new PubSubConfig();
    private PublishConfig publish = new PublishConfig();
    private AllowListConfig allowList = new AllowListConfig();
    private ChallengeConfig challenge = new ChallengeConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public PubSubConfig getPubsub() { return pubsub; }
    public void setPubsub(PubSubConfig pubsub) { this.pubsub = pubsub; }

    public PublishConfig getPublish() { return publish; }
    public void setPublish(PublishConfig publish) { this.publish = publish; }

    public AllowListConfig getAllowList() { return allowList; }
    public void setAllowList(AllowListConfig allowList) { this.allowList = allowList; }

    public ChallengeConfig getChallenge() { return challenge; }
    public void setChallenge(ChallengeConfig challenge) { this.challenge = challenge; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private String path = "/";
        private int workerThreads = 16;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    /**
     * Destination topic. {@code project} and {@code topicName} are required.
     */
    public static class PubSubConfig {
        private String project;
        private String topicName;
        private String topicProject;

        public String getProject() { return project; }
        public void setProject(String project) { this.project = project; }

        public String getTopicName() { return topicName; }
        public void setTopicName(String topicName) { this.topicName = topicName; }

        public String getTopicProject() { return topicProject; }
        public void setTopicProject(String topicProject) { this.topicProject = topicProject; }
    }

    /**
     * Publish behaviour.
     */
    public static class PublishConfig {
        private long timeoutMs = 5000;
        private boolean attributes = true;

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public boolean isAttributes() { return attributes; }
        public void setAttributes(boolean attributes) { this.attributes = attributes; }
    }

    /**
     * Source IP allow-list.
     */
    public static class AllowListConfig {
        private List<String> ranges = new ArrayList<>();
        private String forwardedHeader = "X-Forwarded-For";
        private String malformedPolicy = "permit-all";

        public List<String> getRanges() { return ranges; }
        public void setRanges(List<String> ranges) { this.ranges = ranges; }

        public String getForwardedHeader() { return forwardedHeader; }
        public void setForwardedHeader(String forwardedHeader) { this.forwardedHeader = forwardedHeader; }

        public String getMalformedPolicy() { return malformedPolicy; }
        public void setMalformedPolicy(String malformedPolicy) { this.malformedPolicy = malformedPolicy; }
    }

    /**
     * Challenge handshake detection.
     */
    public static class ChallengeConfig {
        private boolean enabled = true;
        private List<DetectorConfig> detectors = new ArrayList<>(List.of(new DetectorConfig()));

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public List<DetectorConfig> getDetectors() { return detectors; }
        public void setDetectors(List<DetectorConfig> detectors) { this.detectors = detectors; }
    }

    /**
     * Individual challenge detector configuration.
     */
    public static class DetectorConfig {
        private String type = "json-field";
        private String field = "challenge";
        private String echo = "document";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getField() { return field; }
        public void setField(String field) { this.field = field; }

        public String getEcho() { return echo; }
        public void setEcho(String echo) { this.echo = echo; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "webhook_relay";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
