package com.sentryal.insar.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDate;

@Embeddable
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class JobParameters {

    @Column(name = "start_date", nullable = false, updatable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false, updatable = false)
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_mode", nullable = false, updatable = false, length = 16)
    private ProcessingMode processingMode;

    @Column(name = "reference_granule", updatable = false)
    private String referenceGranule;

    @Column(name = "secondary_granule", updatable = false)
    private String secondaryGranule;

    public static JobParameters of(LocalDate startDate, LocalDate endDate, ProcessingMode mode) {
        return new JobParameters(startDate, endDate, mode, null, null);
    }
}
