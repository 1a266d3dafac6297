package com.driveplot.core.model;

import java.util.Objects;

public record Place(String query, String formattedAddress, Coordinate location, String placeId) {
    public Place {
        Objects.requireNonNull(location, "location is required");
        formattedAddress = formattedAddress == null || formattedAddress.isBlank() ? query : formattedAddress;
    }
}
