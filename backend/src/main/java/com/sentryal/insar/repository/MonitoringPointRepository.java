package com.sentryal.insar.repository;

import com.sentryal.insar.model.MonitoringPoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MonitoringPointRepository extends JpaRepository<MonitoringPoint, String> {

    List<MonitoringPoint> findByInfrastructureId(String infrastructureId);
}
