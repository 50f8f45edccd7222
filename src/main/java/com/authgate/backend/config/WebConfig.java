package com.authgate.backend.config;

import com.authgate.backend.common.guard.RateLimitInterceptor;
import com.authgate.backend.common.guard.RateLimitProperties;
import com.authgate.backend.common.guard.RequestRateLimiter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
public class WebConfig implements WebMvcConfigurer {

    private final RateLimitProperties rateLimits;

    public WebConfig(RateLimitProperties rateLimits) {
        this.rateLimits = rateLimits;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        if (!rateLimits.isEnabled()) return;
        registry.addInterceptor(new RateLimitInterceptor(new RequestRateLimiter(), rateLimits))
                .addPathPatterns("/auth/**");
    }
}
