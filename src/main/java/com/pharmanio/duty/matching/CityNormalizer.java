package com.pharmanio.duty.matching;

import com.pharmanio.duty.config.DutyRosterProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps source city codes ("TANA", "DIEGO", ...) to registry city names. Unknown tokens are
 * returned unchanged since the source already spells some cities canonically.
 */
@Component
public class CityNormalizer {

    private final Map<String, String> aliases;

    @Autowired
    public CityNormalizer(DutyRosterProperties properties) {
        this(properties.getCityAliases());
    }

    public CityNormalizer(Map<String, String> aliases) {
        Map<String, String> upper = new LinkedHashMap<>();
        if (aliases != null) {
            aliases.forEach((code, city) -> {
                if (code != null && city != null) upper.put(code.trim().toUpperCase(Locale.ROOT), city);
            });
        }
        this.aliases = Collections.unmodifiableMap(upper);
    }

    public String normalize(String rawCity) {
        if (rawCity == null) return "";
        return aliases.getOrDefault(rawCity.toUpperCase(Locale.ROOT), rawCity);
    }

    public Map<String, String> aliases() {
        return aliases;
    }
}
