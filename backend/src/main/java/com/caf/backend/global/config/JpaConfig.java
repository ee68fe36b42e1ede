package com.caf.backend.global.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@Configuration
@EnableJpaRepositories(basePackages = "com.caf.backend.modules")
@EnableJpaAuditing(dateTimeProviderRef = "entityTimestampProvider")
public class JpaConfig {
}
