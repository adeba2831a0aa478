package com.sentryal.insar.catalog;

import com.sentryal.insar.model.MonitoringPoint;
import com.sentryal.insar.raster.TargetPoint;
import com.sentryal.insar.repository.MonitoringPointRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class JpaPointCatalog implements PointCatalog {

    private final MonitoringPointRepository pointRepository;

    @Override
    @Transactional(readOnly = true)
    public List<TargetPoint> pointsFor(String infrastructureId) {
        return pointRepository.findByInfrastructureId(infrastructureId).stream()
                .map(JpaPointCatalog::toTarget)
                .collect(Collectors.toList());
    }

    private static TargetPoint toTarget(MonitoringPoint point) {
        return new TargetPoint(point.getId(), point.getLatitude(), point.getLongitude());
    }
}
