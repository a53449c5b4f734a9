package com.example.dubbing_backend.exception;

/** Raised by engines for input no retry can fix (unsupported URL, empty speech, rejected request). */
public class UnsupportedInputException extends RuntimeException {
    public UnsupportedInputException(String message) {
        super(message);
    }

    public UnsupportedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
