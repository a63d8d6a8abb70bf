package com.assetpack.exporter.pack;

/**
 * Raised when assets could not be written to a package for a reason other than an {@link java.io.IOException}.
 */
public class PackageWriteException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PackageWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
