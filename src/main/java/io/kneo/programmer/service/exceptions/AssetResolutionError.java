package io.kneo.programmer.service.exceptions;

public class AssetResolutionError extends CompileError {

    public AssetResolutionError(String msg) {
        super(msg);
    }
}
