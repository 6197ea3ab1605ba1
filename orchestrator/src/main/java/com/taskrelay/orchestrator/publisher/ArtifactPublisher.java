package com.taskrelay.orchestrator.publisher;

/**
 * Stores a step's output payload and returns a stable public locator for it.
 */
public interface ArtifactPublisher {

    /**
     * @param content     raw bytes to store
     * @param contentType MIME type, e.g. "audio/mpeg"
     * @return externally dereferenceable locator (URL)
     * @throws PublishException if the payload could not be stored
     */
    String publish(byte[] content, String contentType);
}
