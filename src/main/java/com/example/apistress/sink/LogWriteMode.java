package com.example.apistress.sink;

public enum LogWriteMode {
    /** Start every run with an empty log file. */
    TRUNCATE,
    /** Keep existing lines and add the new run after them. */
    APPEND
}
