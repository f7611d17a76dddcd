package dev.univer.expensebot.config;

import dev.univer.expensebot.service.TelegramProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@Slf4j
public class ClockConfig {

    /** Clock in {@code bot.default-zone-id}, or in the server zone when that is not set. */
    @Bean
    public Clock clock(TelegramProperties props) {
        String zoneId = props.getDefaultZoneId();
        ZoneId zone = (zoneId == null || zoneId.isBlank()) ? ZoneId.systemDefault() : ZoneId.of(zoneId);
        log.info("Expense dates use zone {}", zone);
        return Clock.system(zone);
    }
}
