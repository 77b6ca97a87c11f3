package com.questrail.uplink.internal.exec;

import java.util.UUID;

/**
 * Source of correlation ids. Ids must be unique for as long as a request with
 * that id can be pending.
 */
@FunctionalInterface
public interface CorrelationIdGenerator
{
    String nextId();

    /**
     * Random UUID ids.
     */
    static CorrelationIdGenerator randomUuid() {
        return () -> UUID.randomUUID().toString();
    }
}
