package io.kneo.programmer.service.exceptions;

import lombok.Getter;

/**
 * Failure reported by a horizon extension collaborator. The error code is recorded
 * verbatim on the failed extension attempt.
 */
@Getter
public class PipelineException extends RuntimeException {
    public static final String PIPELINE_EXHAUSTED = "PIPELINE_EXHAUSTED";
    public static final String EPG_DAY_MISSING = "EPG_DAY_MISSING";
    public static final String SCHEDULE_COMPILE_FAILED = "SCHEDULE_COMPILE_FAILED";
    public static final String UNEXPECTED_FAILURE = "UNEXPECTED_FAILURE";

    private final String errorCode;

    public PipelineException(String errorCode) {
        super(errorCode);
        this.errorCode = errorCode;
    }

    public PipelineException(String errorCode, String msg) {
        super(msg);
        this.errorCode = errorCode;
    }

    public PipelineException(String errorCode, String msg, Throwable cause) {
        super(msg, cause);
        this.errorCode = errorCode;
    }
}
