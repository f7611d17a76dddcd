package dev.univer.expensebot.service;

import dev.univer.expensebot.model.UserSettings;
import dev.univer.expensebot.repo.UserSettingsRepository;
import dev.univer.expensebot.util.Currencies;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

@Service
@RequiredArgsConstructor
public class UserSettingsService {
    private final UserSettingsRepository repo;
    private final TelegramProperties props;

    public String defaultCurrency(Long userId) {
        return repo.findByUserId(userId)
                .map(UserSettings::getDefaultCurrency)
                .filter(Currencies::isSupported)
                .orElseGet(this::fallbackCurrency);
    }

    @Transactional
    public UserSettings updateDefaultCurrency(Long userId, String code) {
        if (!Currencies.isSupported(code)) {
            throw new IllegalArgumentException("Unsupported currency: " + code);
        }
        UserSettings s = repo.findByUserId(userId)
                .orElseGet(() -> UserSettings.builder().userId(userId).build());
        s.setDefaultCurrency(code.toUpperCase(Locale.ROOT));
        return repo.save(s);
    }

    /** Configured bot-wide default, or SGD when that is missing or unsupported. */
    public String fallbackCurrency() {
        String configured = props.getDefaultCurrency();
        return Currencies.isSupported(configured)
               ? configured.toUpperCase(Locale.ROOT)
               : Currencies.DEFAULT_CURRENCY;
    }
}
