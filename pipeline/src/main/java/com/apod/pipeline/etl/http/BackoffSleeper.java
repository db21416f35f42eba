package com.apod.pipeline.etl.http;

@FunctionalInterface
public interface BackoffSleeper {
    void sleep(long millis) throws InterruptedException;
}
