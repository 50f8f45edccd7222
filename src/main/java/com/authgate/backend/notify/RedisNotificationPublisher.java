package com.authgate.backend.notify;

import com.authgate.backend.notify.config.MailQueueProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/** LPUSH onto the mail queue; {@link EmailJobConsumer} pops from the other end. */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisNotificationPublisher implements NotificationPublisher {

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final MailQueueProperties props;

    @Override
    public void publish(EmailJob job) {
        try {
            redis.opsForList().leftPush(props.getQueueKey(), objectMapper.writeValueAsString(job));
            log.debug("email job queued purpose={}", job.purpose());
        } catch (JsonProcessingException | DataAccessException e) {
            throw new NotificationPublishException("failed to enqueue email job purpose=" + job.purpose(), e);
        }
    }
}
