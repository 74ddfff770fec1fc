package com.chess.ingest.config;

import com.chess.ingest.pgn.ValidationRules;
import com.chess.ingest.pipeline.BackoffPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

@ConfigurationProperties(prefix = "chess.ingest")
public class IngestProperties {

    /** Records per batch */
    private int batchSize = 1000;

    /** Ceiling on the estimated in-memory size of the buffer, 500 MB by default */
    private long maxBufferBytes = 500L * 1024 * 1024;

    private int maxAttempts = 4;
    private Duration initialBackoff = Duration.ofMillis(500);
    private double backoffMultiplier = 2.0;
    private Duration maxBackoff = Duration.ofSeconds(10);

    private int progressIntervalBatches = 10;

    private int minRating = 1;
    private int maxRating = 3500;
    private int minPlies = 2;
    private int maxPlies = 500;

    private int rejectionSampleSize = 100;

    /** Asynchronous imports allowed to run at the same time */
    private int maxConcurrentImports = 2;

    /** Where multipart uploads are spooled before import */
    private String uploadDirectory = System.getProperty("java.io.tmpdir");

    /** Where the records of batches that could not be committed are written as PGN */
    private String failedBatchDirectory = Path.of(System.getProperty("java.io.tmpdir"), "pgn-failed-batches").toString();

    /** How long a finished background job stays queryable */
    private Duration jobRetention = Duration.ofHours(1);

    public ValidationRules toValidationRules() {
        return new ValidationRules(minRating, maxRating, minPlies, maxPlies, maxBufferBytes);
    }

    public BackoffPolicy toBackoffPolicy() {
        return new BackoffPolicy(initialBackoff, backoffMultiplier, maxBackoff);
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public long getMaxBufferBytes() {
        return maxBufferBytes;
    }

    public void setMaxBufferBytes(long maxBufferBytes) {
        this.maxBufferBytes = maxBufferBytes;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    public int getProgressIntervalBatches() {
        return progressIntervalBatches;
    }

    public void setProgressIntervalBatches(int progressIntervalBatches) {
        this.progressIntervalBatches = progressIntervalBatches;
    }

    public int getMinRating() {
        return minRating;
    }

    public void setMinRating(int minRating) {
        this.minRating = minRating;
    }

    public int getMaxRating() {
        return maxRating;
    }

    public void setMaxRating(int maxRating) {
        this.maxRating = maxRating;
    }

    public int getMinPlies() {
        return minPlies;
    }

    public void setMinPlies(int minPlies) {
        this.minPlies = minPlies;
    }

    public int getMaxPlies() {
        return maxPlies;
    }

    public void setMaxPlies(int maxPlies) {
        this.maxPlies = maxPlies;
    }

    public int getRejectionSampleSize() {
        return rejectionSampleSize;
    }

    public void setRejectionSampleSize(int rejectionSampleSize) {
        this.rejectionSampleSize = rejectionSampleSize;
    }

    public int getMaxConcurrentImports() {
        return maxConcurrentImports;
    }

    public void setMaxConcurrentImports(int maxConcurrentImports) {
        this.maxConcurrentImports = maxConcurrentImports;
    }

    public String getUploadDirectory() {
        return uploadDirectory;
    }

    public void setUploadDirectory(String uploadDirectory) {
        this.uploadDirectory = uploadDirectory;
    }

    public String getFailedBatchDirectory() {
        return failedBatchDirectory;
    }

    public void setFailedBatchDirectory(String failedBatchDirectory) {
        this.failedBatchDirectory = failedBatchDirectory;
    }

    public Duration getJobRetention() {
        return jobRetention;
    }

    public void setJobRetention(Duration jobRetention) {
        this.jobRetention = jobRetention;
    }
}
