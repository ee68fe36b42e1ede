package com.caf.backend.global.config;

import com.caf.backend.modules.access.domain.CapabilityTable;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AccessControlConfig {

    @Bean
    public CapabilityTable capabilityTable() {
        return CapabilityTable.defaults();
    }
}
