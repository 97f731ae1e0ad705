package com.example.apistress.clients;

import com.example.apistress.model.ResultRecord;

/**
 * Performs a single attempt for a descriptor. Implementations never throw: every failure is reported
 * through the returned record.
 */
@FunctionalInterface
public interface RequestExecutor {
    ResultRecord execute(RequestDescriptor descriptor, long requestId);
}
