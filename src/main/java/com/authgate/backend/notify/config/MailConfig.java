package com.authgate.backend.notify.config;

import org.springframework.boot.autoconfigure.mail.MailProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

/**
 * Always provides a sender, Boot only auto-configures one when spring.mail.host is set.
 * Without a host the consumer's sends fail and are logged.
 */
@Configuration
@EnableConfigurationProperties(MailProperties.class)
public class MailConfig {

    @Bean
    public JavaMailSender javaMailSender(MailProperties p) {
        var s = new JavaMailSenderImpl();
        s.setHost(p.getHost());
        if (p.getPort() != null) s.setPort(p.getPort());
        s.setUsername(p.getUsername());
        s.setPassword(p.getPassword());
        if (p.getProtocol() != null) s.setProtocol(p.getProtocol());
        if (p.getDefaultEncoding() != null) s.setDefaultEncoding(p.getDefaultEncoding().name());
        s.getJavaMailProperties().putAll(p.getProperties());
        return s;
    }
}
