package com.driveplot.engine.api;

import com.driveplot.core.model.Place;

import java.util.List;

@FunctionalInterface
public interface Geocoder {
    int MAX_CANDIDATES = 5;

    List<Place> resolve(String query);
}
