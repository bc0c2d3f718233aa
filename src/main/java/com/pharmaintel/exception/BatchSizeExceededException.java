package com.pharmaintel.exception;

public class BatchSizeExceededException extends InventoryIntelligenceException {
    public BatchSizeExceededException(int size, int max) {
        super("BATCH_SIZE_EXCEEDED",
              "Run covers " + size + " items, the maximum per run is " + max + ".");
    }
}
