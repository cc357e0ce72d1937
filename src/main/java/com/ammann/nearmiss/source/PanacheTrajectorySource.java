/* (C)2026 */
package com.ammann.nearmiss.source;

import com.ammann.nearmiss.model.Detection;
import com.ammann.nearmiss.model.Observation;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Default trajectory source backed by the {@link Detection} table.
 *
 * <p>All filters are bound as query parameters; ordering is pushed down to the database.
 */
@ApplicationScoped
public class PanacheTrajectorySource implements TrajectorySource {

    private static final Logger LOG = Logger.getLogger(PanacheTrajectorySource.class);

    @Override
    public List<Observation> fetch(TrajectoryQuery query) {
        long start = System.nanoTime();

        List<Observation> rows =
                Detection.findMatching(query).stream().map(Detection::toObservation).toList();

        LOG.debugf(
                "Fetch took %.2fms: %d detections for %s",
                (System.nanoTime() - start) / 1_000_000.0, rows.size(), query);
        return rows;
    }
}
