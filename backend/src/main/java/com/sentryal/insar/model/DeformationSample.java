package com.sentryal.insar.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Immutable
@Table(name = "deformation_samples",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_deformation_samples_job_point_date",
                columnNames = {"job_id", "point_id", "acquisition_date"}),
        indexes = @Index(name = "idx_deformation_samples_infrastructure", columnList = "infrastructure_id"))
@Getter
@ToString
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DeformationSample {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, length = 36)
    private String jobId;

    @Column(name = "infrastructure_id", nullable = false)
    private String infrastructureId;

    @Column(name = "point_id", nullable = false)
    private String pointId;

    @Column(name = "acquisition_date", nullable = false)
    private LocalDate acquisitionDate;

    @Column(name = "vertical_mm", nullable = false, precision = 10, scale = 2)
    private BigDecimal verticalMm;

    @Column(name = "los_mm", precision = 10, scale = 2)
    private BigDecimal losMm;

    private Double coherence;

    @Column(name = "low_confidence", nullable = false)
    private boolean lowConfidence;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
