package com.authgate.backend.notify.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.mail")
public class MailQueueProperties {

    private String sender = "no-reply@authgate.local";

    /** Redis list holding pending {@code EmailJob} documents. */
    private String queueKey = "queue:email";

    private Consumer consumer = new Consumer();

    @Data
    public static class Consumer {
        private boolean enabled = true;
        private int batchSize = 50;
        private long pollDelayMs = 1000;
    }
}
