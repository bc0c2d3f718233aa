package com.pharmaintel.exception;

import java.util.UUID;

public class JobNotFoundException extends InventoryIntelligenceException {
    public JobNotFoundException(UUID jobId) {
        super("JOB_NOT_FOUND", "Run job with id '" + jobId + "' not found.");
    }
}
