package com.example.apistress.service;

import java.nio.file.Path;
import java.util.UUID;

/** A submitted run names a result log that a queued or running run already owns. */
public class LogFileInUseException extends IllegalStateException {

    private final transient Path logFile;
    private final UUID ownerRunId;

    public LogFileInUseException(Path logFile, UUID ownerRunId) {
        super("Result log " + logFile + " is in use by run " + ownerRunId);
        this.logFile = logFile;
        this.ownerRunId = ownerRunId;
    }

    public Path getLogFile() {
        return logFile;
    }

    public UUID getOwnerRunId() {
        return ownerRunId;
    }
}
