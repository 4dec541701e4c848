package com.hybridrag.corpus;

/**
 * A write prepared by a store or index that is invisible to readers until published.
 * {@link #publish(long)} runs inside the publication critical section and must not fail.
 */
public interface StagedChange {
    void publish(long epoch);

    void rollback();
}
