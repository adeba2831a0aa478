package com.sentryal.insar.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "monitoring_points")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class MonitoringPoint {

    @Id
    private String id;

    @Column(name = "infrastructure_id", nullable = false)
    private String infrastructureId;

    @Column(nullable = false)
    private double latitude;

    @Column(nullable = false)
    private double longitude;
}
