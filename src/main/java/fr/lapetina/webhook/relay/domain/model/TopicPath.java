package fr.lapetina.webhook.relay.domain.model;

import java.util.Objects;

/**
 * Fully qualified Pub/Sub topic: {@code projects/{project}/topics/{topic}}.
 */
public record TopicPath(String project, String topic) {

    public TopicPath {
        Objects.requireNonNull(project, "Project is required");
        Objects.requireNonNull(topic, "Topic is required");
        if (project.isBlank() || topic.isBlank()) {
            throw new IllegalArgumentException("Project and topic must not be blank");
        }
    }

    @Override
    public String toString() {
        return "projects/" + project + "/topics/" + topic;
    }
}
