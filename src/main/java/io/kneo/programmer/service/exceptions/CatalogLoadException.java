package io.kneo.programmer.service.exceptions;

public class CatalogLoadException extends RuntimeException {

    public CatalogLoadException(String msg, Throwable cause) {
        super(msg, cause);
    }

    public CatalogLoadException(String msg) {
        super(msg);
    }
}
