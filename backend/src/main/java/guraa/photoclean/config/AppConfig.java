package guraa.photoclean.config;

import guraa.photoclean.model.BlurSettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Application configuration.
 * Note: Executor configurations live in ConcurrencyConfig.java
 */
@Configuration
public class AppConfig {

    /**
     * Clock for cache session timestamps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Blur metric parameters shared by every scan, validated at startup.
     */
    @Bean
    public BlurSettings blurSettings(ScanProperties properties) {
        return properties.toBlurSettings();
    }
}
