package com.cred.freestyle.repricer.engine.state;

/**
 * Why an evaluation had to fall back to degraded mode.
 *
 * @author Repricer Team
 */
public class EvaluationError {

    private final String operation;
    private final String errorType;
    private final String message;

    public EvaluationError(String operation, Throwable cause) {
        this.operation = operation;
        this.errorType = cause.getClass().getSimpleName();
        this.message = cause.getMessage();
    }

    /**
     * State store operation that failed ("load" or "save").
     */
    public String getOperation() {
        return operation;
    }

    public String getErrorType() {
        return errorType;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return operation + " failed: " + errorType + (message != null ? " - " + message : "");
    }
}
