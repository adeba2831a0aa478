package com.sentryal.insar.client;

import com.sentryal.insar.exception.InsarPipelineException;
import com.sentryal.insar.exception.PermanentRemoteException;
import com.sentryal.insar.exception.TransientRemoteException;
import com.sentryal.insar.model.JobParameters;
import com.sentryal.insar.raster.BandType;
import com.sentryal.insar.raster.TargetPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link ProcessingJobClient} for a serverless GPU endpoint exposing {@code /run},
 * {@code /status/{id}} and {@code /cancel/{id}}. Finished jobs list their products as
 * URLs tagged by band, which are fetched with a separate client so large downloads get
 * their own timeout and no API credentials.
 */
@Slf4j
public class HttpProcessingJobClient implements ProcessingJobClient {

    private final RestClient apiClient;
    private final RestClient downloadClient;
    private final String endpointId;

    public HttpProcessingJobClient(RestClient apiClient, RestClient downloadClient, String endpointId) {
        this.apiClient = apiClient;
        this.downloadClient = downloadClient;
        this.endpointId = endpointId;
    }

    @Override
    public String submit(String jobId, String infrastructureId, JobParameters parameters, List<TargetPoint> points) {
        List<RemoteApi.Point> payloadPoints = points.stream()
                .map(p -> new RemoteApi.Point(p.pointId(), p.latitude(), p.longitude()))
                .toList();
        RemoteApi.Input input = new RemoteApi.Input(
                jobId,
                infrastructureId,
                parameters.getStartDate().toString(),
                parameters.getEndDate().toString(),
                parameters.getProcessingMode().name(),
                parameters.getReferenceGranule(),
                parameters.getSecondaryGranule(),
                payloadPoints);

        RemoteApi.JobResponse response = call("submit job " + jobId, () -> apiClient.post()
                .uri("/{endpoint}/run", endpointId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new RemoteApi.RunRequest(input))
                .retrieve()
                .body(RemoteApi.JobResponse.class));

        if (response == null || response.id() == null || response.id().isBlank()) {
            throw new PermanentRemoteException("Submit for job " + jobId + " returned no remote id");
        }
        log.info("Submitted job {} as remote job {} ({} points)", jobId, response.id(), points.size());
        return response.id();
    }

    @Override
    public RemoteStatusReport status(String remoteJobId) {
        RemoteApi.JobResponse response = fetch(remoteJobId);
        return toReport(remoteJobId, response);
    }

    @Override
    public List<RasterArtifact> downloadArtifacts(String remoteJobId, Path targetDir) {
        RemoteApi.JobResponse response = fetch(remoteJobId);
        if (response.output() == null || response.output().artifacts() == null) {
            throw new PermanentRemoteException("Remote job " + remoteJobId + " lists no artifacts");
        }

        try {
            Files.createDirectories(targetDir);
        } catch (IOException e) {
            throw new InsarPipelineException("Cannot create download directory " + targetDir, e);
        }

        List<RasterArtifact> artifacts = new ArrayList<>();
        for (RemoteApi.Artifact artifact : response.output().artifacts()) {
            Optional<BandType> band = bandType(artifact.band());
            if (band.isEmpty() || artifact.url() == null) {
                log.warn("Skipping artifact of remote job {} with band '{}'", remoteJobId, artifact.band());
                continue;
            }
            URI uri = URI.create(artifact.url());
            Path target = targetDir.resolve(fileName(uri));
            download(uri, target);
            artifacts.add(new RasterArtifact(band.get(), target));
        }
        log.info("Downloaded {} artifacts for remote job {} into {}", artifacts.size(), remoteJobId, targetDir);
        return artifacts;
    }

    @Override
    public void cancel(String remoteJobId) {
        call("cancel remote job " + remoteJobId, () -> apiClient.post()
                .uri("/{endpoint}/cancel/{id}", endpointId, remoteJobId)
                .retrieve()
                .toBodilessEntity());
        log.info("Cancelled remote job {}", remoteJobId);
    }

    private RemoteApi.JobResponse fetch(String remoteJobId) {
        RemoteApi.JobResponse response = call("status of remote job " + remoteJobId, () -> apiClient.get()
                .uri("/{endpoint}/status/{id}", endpointId, remoteJobId)
                .retrieve()
                .body(RemoteApi.JobResponse.class));
        if (response == null || response.status() == null) {
            throw new PermanentRemoteException("Empty status response for remote job " + remoteJobId);
        }
        return response;
    }

    static RemoteStatusReport toReport(String remoteJobId, RemoteApi.JobResponse response) {
        switch (response.status().toUpperCase(Locale.ROOT)) {
            case "IN_QUEUE":
                return RemoteStatusReport.of(RemoteJobStatus.PENDING);
            case "IN_PROGRESS":
                return RemoteStatusReport.of(RemoteJobStatus.RUNNING);
            case "COMPLETED":
                // the worker reports its own failures inside a completed envelope
                if (response.output() != null && "error".equalsIgnoreCase(response.output().status())) {
                    return new RemoteStatusReport(RemoteJobStatus.FAILED, response.output().error());
                }
                return RemoteStatusReport.of(RemoteJobStatus.SUCCEEDED);
            case "FAILED":
            case "CANCELLED":
            case "TIMED_OUT":
                return new RemoteStatusReport(RemoteJobStatus.FAILED,
                        response.error() != null ? response.error() : response.status());
            default:
                throw new PermanentRemoteException("Unknown status '" + response.status()
                        + "' for remote job " + remoteJobId);
        }
    }

    static Optional<BandType> bandType(String band) {
        if (band == null) {
            return Optional.empty();
        }
        switch (band.toLowerCase(Locale.ROOT)) {
            case "vertical":
            case "vert_disp":
                return Optional.of(BandType.VERTICAL);
            case "los":
            case "los_disp":
            case "line_of_sight":
                return Optional.of(BandType.LINE_OF_SIGHT);
            case "coherence":
            case "corr":
                return Optional.of(BandType.COHERENCE);
            default:
                return Optional.empty();
        }
    }

    private void download(URI uri, Path target) {
        call("download " + uri, () -> downloadClient.get()
                .uri(uri)
                .exchange((request, response) -> {
                    HttpStatusCode status = response.getStatusCode();
                    if (status.isError()) {
                        throw classify("download " + uri, status, null);
                    }
                    try (InputStream body = response.getBody()) {
                        Files.copy(body, target, StandardCopyOption.REPLACE_EXISTING);
                    }
                    return target;
                }));
    }

    private static String fileName(URI uri) {
        String path = uri.getPath();
        String name = path == null ? "" : path.substring(path.lastIndexOf('/') + 1);
        if (name.isBlank() || name.contains("..")) {
            throw new PermanentRemoteException("Artifact URL has no usable file name: " + uri);
        }
        return name;
    }

    private static <T> T call(String action, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            throw classify(action, e.getStatusCode(), e);
        } catch (ResourceAccessException e) {
            throw new TransientRemoteException("I/O failure during " + action + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new PermanentRemoteException("Unusable response during " + action + ": " + e.getMessage(), e);
        }
    }

    private static InsarPipelineException classify(String action, HttpStatusCode status, Throwable cause) {
        String message = "HTTP " + status.value() + " during " + action;
        if (status.is5xxServerError() || status.value() == HttpStatus.TOO_MANY_REQUESTS.value()
                || status.value() == HttpStatus.REQUEST_TIMEOUT.value()) {
            return new TransientRemoteException(message, cause);
        }
        return new PermanentRemoteException(message, cause);
    }
}
