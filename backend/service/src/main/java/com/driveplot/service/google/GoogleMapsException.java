package com.driveplot.service.google;

import com.driveplot.engine.api.RemoteCallException;

public class GoogleMapsException extends RemoteCallException {
    public GoogleMapsException(String message) {
        super(message);
    }

    public GoogleMapsException(String message, Throwable cause) {
        super(message, cause);
    }
}
