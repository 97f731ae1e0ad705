package com.example.apistress.clients;

import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;

/** Categories of transport-level failures recorded in the {@code error} field of a result. */
public enum TransportFailure {
    TIMEOUT,
    CONNECT,
    DNS,
    TLS,
    IO,
    INTERRUPTED,
    EXCEPTION;

    public static TransportFailure classify(Throwable failure) {
        Throwable t = unwrap(failure);
        if (t == null) {
            return EXCEPTION;
        }
        if (t instanceof InterruptedException) {
            return INTERRUPTED;
        }
        if (t instanceof HttpTimeoutException || t instanceof TimeoutException) {
            return TIMEOUT;
        }
        if (t instanceof UnknownHostException || t instanceof UnresolvedAddressException) {
            return DNS;
        }
        if (t instanceof SSLException) {
            return TLS;
        }
        if (t instanceof ConnectException) {
            // the JDK client wraps resolution failures in a bare ConnectException
            return t.getCause() instanceof UnresolvedAddressException ? DNS : CONNECT;
        }
        String msg = String.valueOf(t.getMessage()).toLowerCase();
        if (msg.contains("timed out") || msg.contains("timeout")) {
            return TIMEOUT;
        }
        if (t instanceof IOException) {
            return IO;
        }
        return EXCEPTION;
    }

    public String describe(Throwable failure) {
        Throwable t = unwrap(failure);
        String message = t == null ? null : t.getMessage();
        if (message == null || message.isBlank()) {
            message = t == null ? "unknown failure" : t.getClass().getSimpleName();
        }
        return name() + ": " + message;
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable t = failure;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
