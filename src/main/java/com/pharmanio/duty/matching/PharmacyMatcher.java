package com.pharmanio.duty.matching;

import com.pharmanio.duty.config.DutyRosterProperties;
import com.pharmanio.duty.domain.pharmacy.Pharmacy;
import com.pharmanio.duty.ingestion.model.RawListing;
import com.pharmanio.duty.repository.PharmacyRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

/**
 * Resolves a scraped pharmacy name to a canonical registry entry within the same city.
 */
@Slf4j
@Component
public class PharmacyMatcher {

    private final PharmacyRepository pharmacyRepository;
    private final CityNormalizer cityNormalizer;
    private final double threshold;

    @Autowired
    public PharmacyMatcher(PharmacyRepository pharmacyRepository,
                           CityNormalizer cityNormalizer,
                           DutyRosterProperties properties) {
        this(pharmacyRepository, cityNormalizer, properties.getSimilarityThreshold());
    }

    public PharmacyMatcher(PharmacyRepository pharmacyRepository, CityNormalizer cityNormalizer, double threshold) {
        this.pharmacyRepository = pharmacyRepository;
        this.cityNormalizer = cityNormalizer;
        this.threshold = threshold;
    }

    @Transactional(readOnly = true)
    public MatchResult match(RawListing listing) {
        if (!listing.isMatchable()) {
            log.debug("Skipping listing without name or city: name='{}', address='{}'", listing.name(), listing.address());
            return MatchResult.skipped(listing.name(), listing.cityToken());
        }
        return match(listing.name(), cityNormalizer.normalize(listing.cityToken()));
    }

    /**
     * Best candidate by similarity ratio; the first candidate in id order wins ties. Accepted only
     * when the ratio is strictly above the configured threshold.
     */
    @Transactional(readOnly = true)
    public MatchResult match(String rawName, String city) {
        List<Pharmacy> candidates = pharmacyRepository.findAllByCity_NameOrderByIdAsc(city);
        if (candidates.isEmpty()) {
            log.warn("No pharmacies found in city: {} (listing '{}')", city, rawName);
            return MatchResult.noCityCoverage(rawName, city);
        }

        Pharmacy best = null;
        double bestRatio = 0;
        for (Pharmacy candidate : candidates) {
            double ratio = SimilarityRatio.ignoreCase(rawName, candidate.getName());
            if (ratio > bestRatio) {
                bestRatio = ratio;
                best = candidate;
            }
        }

        if (best != null && bestRatio > threshold) {
            log.info("Matched '{}' in {} with '{}' (id={}, similarity: {})",
                    rawName, city, best.getName(), best.getId(), format(bestRatio));
            return MatchResult.matched(rawName, city, best.getId(), bestRatio);
        }

        log.warn("No good match found for '{}' in {} (best similarity: {})", rawName, city, format(bestRatio));
        return MatchResult.noConfidentMatch(rawName, city, bestRatio);
    }

    private static String format(double ratio) {
        return String.format(Locale.ROOT, "%.2f", ratio);
    }
}
