package com.sentryal.insar.client;

import com.sentryal.insar.model.JobParameters;
import com.sentryal.insar.raster.TargetPoint;

import java.nio.file.Path;
import java.util.List;

/**
 * Remote InSAR processing service.
 *
 * <p>Every method throws {@link com.sentryal.insar.exception.TransientRemoteException}
 * for failures worth retrying and
 * {@link com.sentryal.insar.exception.PermanentRemoteException} for rejections.
 */
public interface ProcessingJobClient {

    /**
     * @return the remote job id
     */
    String submit(String jobId, String infrastructureId, JobParameters parameters, List<TargetPoint> points);

    RemoteStatusReport status(String remoteJobId);

    /**
     * Downloads every raster product of a finished job into {@code targetDir}.
     */
    List<RasterArtifact> downloadArtifacts(String remoteJobId, Path targetDir);

    void cancel(String remoteJobId);
}
