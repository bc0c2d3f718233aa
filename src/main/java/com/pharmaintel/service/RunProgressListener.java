package com.pharmaintel.service;

@FunctionalInterface
public interface RunProgressListener {

    RunProgressListener NONE = (processed, total) -> { };

    void itemProcessed(int processed, int total);
}
