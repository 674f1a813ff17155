package com.example.examSchedulerBackend.service.vision;

/**
 * One hosted model able to read an image and describe it as text.
 */
public interface VisionBackend {

    String getName();

    /**
     * Blocking call. Throws {@link VisionBackendException} when the backend
     * cannot serve the request.
     */
    String analyze(byte[] image, String mimeType);
}
