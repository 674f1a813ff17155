package com.example.examSchedulerBackend.service.vision;

import lombok.Getter;

@Getter
public class VisionBackendException extends RuntimeException {

    private final String backend;

    // the backend rejected the model or request outright, as opposed to a transient failure
    private final boolean unsupported;

    public VisionBackendException(String backend, String message, boolean unsupported) {
        super(message);
        this.backend = backend;
        this.unsupported = unsupported;
    }

    public VisionBackendException(String backend, String message, boolean unsupported, Throwable cause) {
        super(message, cause);
        this.backend = backend;
        this.unsupported = unsupported;
    }
}
