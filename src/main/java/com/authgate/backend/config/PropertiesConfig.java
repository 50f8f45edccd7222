package com.authgate.backend.config;

import com.authgate.backend.auth.config.AuthProperties;
import com.authgate.backend.notify.config.MailQueueProperties;
import com.authgate.backend.twofactor.config.TwoFactorProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        AuthProperties.class,
        TwoFactorProperties.class,
        MailQueueProperties.class
})
public class PropertiesConfig {
}
