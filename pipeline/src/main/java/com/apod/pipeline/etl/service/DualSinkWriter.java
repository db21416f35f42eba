package com.apod.pipeline.etl.service;

import com.apod.pipeline.etl.model.ApodRecord;

public interface DualSinkWriter {

    void upsert(ApodRecord record);

    /**
     * Merges the record into the flat file, replacing any row with the same date.
     *
     * @return total number of rows in the file after the merge
     */
    int appendAndDedupe(ApodRecord record);
}
