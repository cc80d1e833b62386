package com.project.lingodeck.backend.session;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "lingodeck.session")
public class SessionSettings {

    /** Upper bound on the review queue of one session. 0 = no limit. */
    private int maxCardsPerSession = 20;

    /** How long a request waits for the learner's previous request to finish. */
    private Duration lockTimeout = Duration.ofSeconds(5);
}
