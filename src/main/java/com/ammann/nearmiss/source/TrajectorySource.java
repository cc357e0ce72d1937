/* (C)2026 */
package com.ammann.nearmiss.source;

import com.ammann.nearmiss.model.Observation;
import java.util.List;

/**
 * Read-only access to the trajectory store.
 *
 * <p>Implementations return every observation satisfying the query, ordered ascending by
 * timestamp (ties by id). The engine calls this once per stream before computing, and
 * never blocks on I/O afterwards.
 */
public interface TrajectorySource {

    /**
     * Fetches observations matching the query.
     *
     * @param query typed class/time/zone/tracking-id predicate
     * @return time-ordered observations, never {@code null}
     */
    List<Observation> fetch(TrajectoryQuery query);
}
