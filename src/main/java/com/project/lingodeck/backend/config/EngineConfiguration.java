package com.project.lingodeck.backend.config;

import com.project.lingodeck.backend.algorithm.Scheduler;
import com.project.lingodeck.backend.algorithm.SchedulerSettings;
import com.project.lingodeck.backend.session.ReviewSessionStateMachine;
import com.project.lingodeck.backend.session.SessionSettings;
import com.project.lingodeck.backend.session.SessionStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the framework-free review engine (scheduler and state machine)
 * into the Spring context.
 */
@Configuration
@EnableConfigurationProperties({SchedulerSettings.class, SessionSettings.class})
public class EngineConfiguration {

    @Bean
    public Scheduler scheduler(SchedulerSettings schedulerSettings) {
        return new Scheduler(schedulerSettings);
    }

    @Bean
    public ReviewSessionStateMachine reviewSessionStateMachine(SessionStore sessionStore,
                                                               Scheduler scheduler,
                                                               SessionSettings sessionSettings) {
        return new ReviewSessionStateMachine(sessionStore, scheduler, sessionSettings);
    }

    //"now" for every transition; replaced by a fixed clock in tests
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
