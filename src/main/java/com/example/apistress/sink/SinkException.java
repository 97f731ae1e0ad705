package com.example.apistress.sink;

/** Raised when the result log cannot be opened or written. Fatal for the run that owns the sink. */
public class SinkException extends RuntimeException {

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
