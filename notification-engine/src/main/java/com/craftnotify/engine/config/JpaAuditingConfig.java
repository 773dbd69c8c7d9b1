package com.craftnotify.engine.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Enables population of {@code @CreatedDate} / {@code @LastModifiedDate}.
 */
@Configuration
@EnableJpaAuditing
public class JpaAuditingConfig {
}
