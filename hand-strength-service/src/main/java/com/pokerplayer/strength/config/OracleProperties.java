package com.pokerplayer.strength.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for the external hand ranking service.
 */
@Data
@ConfigurationProperties(prefix = "poker.oracle")
public class OracleProperties {

    private boolean enabled = true;

    private String baseUrl = "https://rainman.leanpoker.org";

    /**
     * Hard deadline for one ranking attempt
     */
    private Duration callTimeout = Duration.ofSeconds(3);

    /**
     * HTTP budget for connecting and reading; must not be shorter than the call timeout
     */
    private Duration requestTimeout = Duration.ofSeconds(5);
}
