package org.lsst.fits.linedefect.batch;

import java.nio.file.Path;
import org.lsst.fits.linedefect.InspectionResult;

/**
 * The outcome of inspecting one file of a batch.
 *
 * @author tonyj
 */
public class BatchItemResult {

    public enum Status {
        /** No defects found */
        PASS,
        /** At least one defect found */
        FAIL,
        /** The file could not be inspected */
        ERROR
    }

    private final Path path;
    private final Status status;
    private final InspectionResult result;
    private final long elapsedMillis;
    private final String error;

    private BatchItemResult(Path path, Status status, InspectionResult result, long elapsedMillis, String error) {
        this.path = path;
        this.status = status;
        this.result = result;
        this.elapsedMillis = elapsedMillis;
        this.error = error;
    }

    static BatchItemResult inspected(Path path, InspectionResult result, long elapsedMillis) {
        return new BatchItemResult(path, result.isDefective() ? Status.FAIL : Status.PASS, result, elapsedMillis, null);
    }

    static BatchItemResult failed(Path path, Throwable cause) {
        String message = cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
        return new BatchItemResult(path, Status.ERROR, null, 0, message);
    }

    public Path getPath() {
        return path;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * @return The inspection result, or <code>null</code> if the status is
     * ERROR
     */
    public InspectionResult getResult() {
        return result;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    /**
     * @return The error message, or <code>null</code> unless the status is
     * ERROR
     */
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "BatchItemResult{" + "path=" + path + ", status=" + status + ", elapsedMillis=" + elapsedMillis + (error == null ? "" : ", error=" + error) + '}';
    }
}
