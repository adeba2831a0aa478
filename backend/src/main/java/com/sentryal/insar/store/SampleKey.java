package com.sentryal.insar.store;

import java.time.LocalDate;

public record SampleKey(String pointId, LocalDate acquisitionDate) {
}
