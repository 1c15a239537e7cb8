package io.electionradar.ingestion.pipeline;

/**
 * Log sinks supplied by whoever invoked the run (for example a function host).
 */
public interface ExecutionContext {

    void log(String message);

    void error(String message);
}
