/* (C)2026 */
package com.ammann.nearmiss.source;

import com.ammann.nearmiss.model.Observation;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Trajectory source over a fixed snapshot of observations.
 *
 * <p>Used for embedding the engine without a database and for replaying recorded
 * feeds. The snapshot is copied on construction; each fetch filters and sorts it.
 */
public class InMemoryTrajectorySource implements TrajectorySource {

    static final Comparator<Observation> TIME_ORDER =
            Comparator.comparing(Observation::timestamp)
                    .thenComparing(Observation::id, Comparator.nullsLast(Comparator.naturalOrder()));

    private final List<Observation> observations;

    public InMemoryTrajectorySource(List<Observation> observations) {
        this.observations = List.copyOf(Objects.requireNonNull(observations, "observations"));
    }

    @Override
    public List<Observation> fetch(TrajectoryQuery query) {
        return observations.stream().filter(query::matches).sorted(TIME_ORDER).toList();
    }

    public int size() {
        return observations.size();
    }
}
