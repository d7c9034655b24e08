package com.signalplatform.common.exception;

/**
 * Raised when a stage cannot decide because its input is too thin: too few analyzable
 * timeframes, or too few candles for the gate. The pipeline maps it to NO_TRADE.
 */
public class InsufficientDataException extends RuntimeException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
