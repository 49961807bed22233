package com.regionmatch.processing;

/**
 * Thrown when the gazetteer or the alias table cannot be loaded, or is unusable.
 */
public class RegionDataException extends RuntimeException {

    public RegionDataException(String message) {
        super(message);
    }

    public RegionDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
