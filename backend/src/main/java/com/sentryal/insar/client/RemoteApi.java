package com.sentryal.insar.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

final class RemoteApi {

    private RemoteApi() {
    }

    record RunRequest(Input input) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Input(@JsonProperty("job_id") String jobId,
                 @JsonProperty("infrastructure_id") String infrastructureId,
                 @JsonProperty("start_date") String startDate,
                 @JsonProperty("end_date") String endDate,
                 @JsonProperty("processing_mode") String processingMode,
                 @JsonProperty("reference_granule") String referenceGranule,
                 @JsonProperty("secondary_granule") String secondaryGranule,
                 List<Point> points) {
    }

    record Point(String id, double lat, double lon) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record JobResponse(String id, String status, Output output, String error) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Output(String status, List<Artifact> artifacts, String error) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Artifact(String band, String url) {
    }
}
