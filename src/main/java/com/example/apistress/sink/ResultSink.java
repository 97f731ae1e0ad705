package com.example.apistress.sink;

import com.example.apistress.model.ResultRecord;

/**
 * Durable destination for result records. Implementations must accept concurrent callers and persist each
 * record exactly once per call.
 */
public interface ResultSink {

    void append(ResultRecord record) throws SinkException;
}
