package com.driveplot.engine.assemble;

public class EmptySeriesException extends RuntimeException {
    public EmptySeriesException(String message) {
        super(message);
    }
}
