package com.example.contextsync.service;

import lombok.Value;

/**
 * Outcome of one broadcast cycle.
 */
@Value
public class BroadcastReport {

    long version;
    int recipients;
    int delivered;
    int failed;
    int skipped;

    /** True when a newer cycle had already started and this one sent nothing. */
    boolean superseded;

    static BroadcastReport superseded(long version) {
        return new BroadcastReport(version, 0, 0, 0, 0, true);
    }
}
