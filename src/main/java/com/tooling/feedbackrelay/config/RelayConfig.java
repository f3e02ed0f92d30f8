package com.tooling.feedbackrelay.config;

import com.tooling.feedbackrelay.integration.InMemorySettingsStore;
import com.tooling.feedbackrelay.integration.LoggingSurfaceLauncher;
import com.tooling.feedbackrelay.integration.SessionResourceReleaser;
import com.tooling.feedbackrelay.integration.SettingsStore;
import com.tooling.feedbackrelay.integration.SurfaceLauncher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Defaults for the collaborators that live outside this service. A desktop
 * shell or persistent settings layer replaces them by declaring its own beans.
 */
@Configuration
@Slf4j
public class RelayConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public SurfaceLauncher surfaceLauncher() {
        return new LoggingSurfaceLauncher();
    }

    @Bean
    @ConditionalOnMissingBean
    public SettingsStore settingsStore() {
        return new InMemorySettingsStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionResourceReleaser sessionResourceReleaser() {
        return session -> log.debug("No resources to release for session {}", session.getId());
    }
}
