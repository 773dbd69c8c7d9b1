package com.craftnotify.engine.config;

import com.sendgrid.SendGrid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "notification.providers.email", name = "enabled", havingValue = "true")
@Slf4j
public class SendGridConfig {

    @Bean
    public SendGrid sendGrid(NotificationProperties properties) {
        String apiKey = properties.getProviders().getEmail().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException(
                "notification.providers.email.api-key must be set when the email provider is enabled");
        }
        log.info("SendGrid client configured for email channel");
        return new SendGrid(apiKey);
    }
}
