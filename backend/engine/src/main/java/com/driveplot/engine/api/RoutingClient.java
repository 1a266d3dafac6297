package com.driveplot.engine.api;

import com.driveplot.core.model.Coordinate;
import com.driveplot.core.model.TrafficModel;

@FunctionalInterface
public interface RoutingClient {
    /**
     * Driving duration in seconds for a departure at {@code departureEpochSeconds}.
     *
     * @throws RemoteCallException when the upstream service does not report success
     */
    long fetchDurationSeconds(Coordinate origin, Coordinate destination, long departureEpochSeconds, TrafficModel model);
}
