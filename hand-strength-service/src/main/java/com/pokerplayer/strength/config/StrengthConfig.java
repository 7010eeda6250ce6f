package com.pokerplayer.strength.config;

import com.pokerplayer.evaluator.CombinationEvaluator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

@Configuration
@EnableConfigurationProperties({OracleProperties.class, StrengthProperties.class})
public class StrengthConfig {

    @Bean
    public CombinationEvaluator combinationEvaluator() {
        return new CombinationEvaluator();
    }

    @Bean
    public ClassifierThresholds classifierThresholds(StrengthProperties properties) {
        return properties.toThresholds();
    }

    @Bean
    public HttpClient oracleHttpClient(OracleProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getRequestTimeout())
                .build();
    }
}
