package com.pharmanio.duty.domain.pharmacy;

import com.pharmanio.duty.domain.city.City;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Canonical registry entry. Rows are written by the bulk import and geocoding tools;
 * the roster pipeline only reads them and references them by id.
 */
@Entity
@Table(
        name = "pharmacies",
        indexes = {
                @Index(name = "idx_pharmacies_city_id", columnList = "city_id"),
                @Index(name = "idx_pharmacies_coordinates", columnList = "latitude,longitude"),
                @Index(name = "idx_pharmacies_name", columnList = "name")
        }
)
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Pharmacy {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "city_id", nullable = false)
    private City city;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 500)
    private String address;

    // comma separated
    @Column(length = 200)
    private String phone;

    private Double latitude;

    private Double longitude;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }
}
