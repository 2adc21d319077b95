package com.mouse.betinfo.model;

/**
 * Id and stored hash of a row, read without materialising the record.
 */
public interface RecordKey {
    String getId();

    String getContentHash();
}
