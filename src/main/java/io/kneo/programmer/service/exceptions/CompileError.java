package io.kneo.programmer.service.exceptions;

public class CompileError extends RuntimeException {

    public CompileError(String msg) {
        super(msg);
    }

    public CompileError(String msg, Throwable cause) {
        super(msg, cause);
    }

    public String getDeveloperMessage() {
        return getMessage();
    }
}
