package com.authgate.backend.notify;

import com.authgate.backend.notify.config.MailQueueProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drains the mail queue and attempts each job once. A failed send is logged and dropped;
 * the user can request another link.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.mail.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EmailJobConsumer {

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final JavaMailSender mailSender;
    private final MailQueueProperties props;

    @Scheduled(fixedDelayString = "${app.mail.consumer.poll-delay-ms:1000}")
    public void poll() {
        int sent = drain();
        if (sent > 0) log.info("email queue drained sent={}", sent);
    }

    /** @return number of jobs handed to the mail server in this pass */
    public int drain() {
        int sent = 0;
        int batch = Math.max(1, props.getConsumer().getBatchSize());
        for (int i = 0; i < batch; i++) {
            String raw;
            try {
                raw = redis.opsForList().rightPop(props.getQueueKey());
            } catch (DataAccessException e) {
                log.warn("mail queue unavailable: {}", e.getMessage());
                return sent;
            }
            if (raw == null) return sent;
            if (deliver(raw)) sent++;
        }
        return sent;
    }

    boolean deliver(String raw) {
        EmailJob job;
        try {
            job = objectMapper.readValue(raw, EmailJob.class);
        } catch (JsonProcessingException e) {
            log.warn("dropping malformed email job: {}", e.getOriginalMessage());
            return false;
        }
        if (job.to() == null || job.to().isBlank() || job.link() == null) {
            log.warn("dropping email job without recipient or link purpose={}", job.purpose());
            return false;
        }

        var msg = new SimpleMailMessage();
        msg.setFrom(props.getSender());
        msg.setTo(job.to());
        msg.setSubject(job.subject() != null ? job.subject() : "Notification");
        msg.setText(body(job));
        try {
            mailSender.send(msg);
            return true;
        } catch (MailException e) {
            log.warn("email send failed purpose={}: {}", job.purpose(), e.getMessage());
            return false;
        }
    }

    private static String body(EmailJob job) {
        if (EmailJob.PURPOSE_TWO_FACTOR.equals(job.purpose())) {
            return "Someone asked to sign in to your account.\n\n"
                    + "Open this link to confirm it was you:\n" + job.link() + "\n\n"
                    + "The link works once and expires shortly. If this was not you, ignore this email.";
        }
        return "Welcome! Please confirm your email address by opening the link below:\n\n"
                + job.link() + "\n\n"
                + "If you did not create an account, you can ignore this email.";
    }
}
