package com.pharmanio.duty.domain.roster;

import com.pharmanio.duty.ingestion.model.ValidityPeriod;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * The single on-duty roster. The lowest-id row is the roster; it is updated in place on every
 * successful ingest and never appended to.
 */
@Entity
@Table(name = "on_duty_pharmacies")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OnDutyRoster {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Convert(converter = PharmacyIdListConverter.class)
    @Column(name = "pharmacy_ids", length = 8000)
    @Builder.Default
    private List<Long> pharmacyIds = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    public ValidityPeriod period() {
        return new ValidityPeriod(startDate, endDate);
    }

    /**
     * Replaces period and ids together and stamps the update time.
     */
    public void replace(ValidityPeriod period, List<Long> ids, Instant now) {
        this.startDate = period.start();
        this.endDate = period.end();
        this.pharmacyIds = new ArrayList<>(ids);
        this.updatedAt = now;
    }
}
