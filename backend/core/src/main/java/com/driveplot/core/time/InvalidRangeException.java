package com.driveplot.core.time;

public class InvalidRangeException extends IllegalArgumentException {
    public InvalidRangeException(String message) {
        super(message);
    }
}
