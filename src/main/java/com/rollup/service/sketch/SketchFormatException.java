package com.rollup.service.sketch;

/**
 * Thrown when sketch bytes cannot be decoded or two sketches cannot be unioned.
 *
 * The receiving sketch is always left unchanged when this is thrown.
 */
public class SketchFormatException extends RuntimeException {

    public SketchFormatException(String message) {
        super(message);
    }

    public SketchFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
