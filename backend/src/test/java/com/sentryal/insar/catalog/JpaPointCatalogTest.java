package com.sentryal.insar.catalog;

import com.sentryal.insar.model.MonitoringPoint;
import com.sentryal.insar.raster.TargetPoint;
import com.sentryal.insar.repository.MonitoringPointRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(JpaPointCatalog.class)
public class JpaPointCatalogTest {

    @Autowired
    private MonitoringPointRepository pointRepository;

    @Autowired
    private PointCatalog pointCatalog;

    @Test
    public void testPointsFor_OnlyThatInfrastructure() {
        pointRepository.save(new MonitoringPoint("bridge-7-001", "bridge-7", 49.95, 10.05));
        pointRepository.save(new MonitoringPoint("dam-2-001", "dam-2", 46.1, 8.7));

        List<TargetPoint> points = pointCatalog.pointsFor("bridge-7");

        assertEquals(List.of(new TargetPoint("bridge-7-001", 49.95, 10.05)), points);
        assertTrue(pointCatalog.pointsFor("unknown").isEmpty());
    }
}
