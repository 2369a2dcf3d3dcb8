package me.internalizable.socialflood.orchestrator;

import java.time.Duration;

public class OrchestrationTimeoutException extends OrchestrationException {

    private final String operation;
    private final Duration timeout;

    public OrchestrationTimeoutException(String operation, Duration timeout) {
        super("Upstream call " + operation + " did not complete within " + timeout.toMillis() + "ms");
        this.operation = operation;
        this.timeout = timeout;
    }

    public String getOperation() {
        return operation;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
