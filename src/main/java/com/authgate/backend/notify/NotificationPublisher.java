package com.authgate.backend.notify;

/** Hands an email off for asynchronous delivery. Never waits for the send itself. */
public interface NotificationPublisher {

    /**
     * @throws NotificationPublishException when the job could not be handed off
     */
    void publish(EmailJob job);
}
