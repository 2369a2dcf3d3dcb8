package me.internalizable.socialflood.orchestrator;

public class UpstreamException extends OrchestrationException {

    private final String operation;

    public UpstreamException(String operation, Throwable cause) {
        super("Upstream call " + operation + " failed: " + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
