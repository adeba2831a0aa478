package com.sentryal.insar.catalog;

import com.sentryal.insar.raster.TargetPoint;

import java.util.List;

public interface PointCatalog {

    List<TargetPoint> pointsFor(String infrastructureId);
}
