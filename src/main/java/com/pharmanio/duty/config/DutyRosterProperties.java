package com.pharmanio.duty.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Strongly typed configuration for roster matching and refresh scheduling.
 */
@Getter
@Setter
@Validated
@Component
@ConfigurationProperties(prefix = "pharmanio.duty")
public class DutyRosterProperties {

    /**
     * A listing matches only when its best similarity ratio is strictly above this value.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.4;

    /**
     * Source city code to registry city name. Keys are compared case-insensitively.
     */
    @NotNull
    private Map<String, String> cityAliases = defaultCityAliases();

    /**
     * Zone used to decide what "today" is when checking roster expiry.
     */
    @NotBlank
    private String timeZone = "Indian/Antananarivo";

    /**
     * Whether the daily expiry check runs.
     */
    private boolean schedulerEnabled = true;

    /**
     * Cron expression for the daily expiry check.
     */
    @NotBlank
    private String schedulerCron = "0 0 6 * * *";

    /**
     * Whether the expiry check also runs once when the application is ready.
     */
    private boolean checkOnStartup = true;

    public static Map<String, String> defaultCityAliases() {
        Map<String, String> aliases = new LinkedHashMap<>();
        aliases.put("TANA", "Antananarivo");
        aliases.put("ANTSIRABE", "Antsirabe");
        aliases.put("FIANARANTSOA", "Fianarantsoa");
        aliases.put("TAMATAVE", "Toamasina");
        aliases.put("DIEGO", "Antsiranana");
        aliases.put("TULEAR", "Toliara");
        aliases.put("MAJUNGA", "Mahajanga");
        return aliases;
    }
}
