/*
 * Copyright (c) 2024 Hal Hildebrand. All rights reserved.
 * This file is part of Targets, licensed under the GNU Affero General Public License v3.0 (AGPL-3.0).
 * See LICENSE file for details.
 */

package com.hellblazer.targets.job;

/**
 * Sealed exception hierarchy for render runs.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link PersistenceException} - an output image could not be created or encoded; fatal to the run</li>
 * <li>{@link JobFailedException} - a job failed unexpectedly while rendering; fatal to the run</li>
 * <li>{@link InvalidCatalogException} - the static configuration is malformed</li>
 * </ul>
 */
public sealed class RenderException extends RuntimeException
    permits RenderException.PersistenceException,
            RenderException.JobFailedException,
            RenderException.InvalidCatalogException {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Output could not be written.
     */
    public static final class PersistenceException extends RenderException {
        private final String fileName;

        public PersistenceException(String fileName, Throwable cause) {
            super("Failed to write " + fileName + ": " + cause.getMessage(), cause);
            this.fileName = fileName;
        }

        public String getFileName() {
            return fileName;
        }
    }

    /**
     * A job threw while synthesizing, converting or post-processing.
     */
    public static final class JobFailedException extends RenderException {
        private final String jobName;

        public JobFailedException(String jobName, Throwable cause) {
            super("Job " + jobName + " failed: " + cause, cause);
            this.jobName = jobName;
        }

        public String getJobName() {
            return jobName;
        }
    }

    /**
     * Rejected before dispatch: zero densities, duplicate size classes and the like.
     */
    public static final class InvalidCatalogException extends RenderException {

        public InvalidCatalogException(String message) {
            super(message);
        }
    }
}
