package com.taskrelay.orchestrator.capability;

/**
 * The content transformations local steps delegate to a model provider.
 *
 * Calls are synchronous; the caller is a worker thread that only blocks the
 * progress of its own task.
 */
public interface CapabilityProvider {

    /**
     * @throws CapabilityException if the provider fails or returns nothing usable
     */
    String translate(String text, String sourceLanguage, String targetLanguage);

    /**
     * @return encoded audio (MP3)
     * @throws CapabilityException if the provider fails
     */
    byte[] synthesizeSpeech(String text);
}
