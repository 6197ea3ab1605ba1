package com.taskrelay.orchestrator.capability;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Capability provider backed by the OpenAI REST API.
 *
 * Translation goes through chat completions, speech through the audio/speech
 * endpoint. Raw java.net.http keeps every header and byte on the wire visible.
 */
@Component
public class OpenAiCapabilityProvider implements CapabilityProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCapabilityProvider.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChatResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Choice(Message message) {}

        public String firstContent() {
            if (choices == null || choices.isEmpty() || choices.get(0).message() == null) {
                throw new CapabilityException("No choices in chat completion response");
            }
            return choices.get(0).message().content();
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       baseUrl;
    private final String       chatModel;
    private final String       speechModel;
    private final String       voice;

    public OpenAiCapabilityProvider(
            @Value("${taskrelay.openai.api-key:}") String apiKey,
            @Value("${taskrelay.openai.base-url:https://api.openai.com/v1}") String baseUrl,
            @Value("${taskrelay.openai.chat-model:gpt-4}") String chatModel,
            @Value("${taskrelay.openai.speech-model:tts-1}") String speechModel,
            @Value("${taskrelay.openai.voice:alloy}") String voice,
            ObjectMapper objectMapper) {
        this.apiKey      = apiKey;
        this.baseUrl     = baseUrl;
        this.chatModel   = chatModel;
        this.speechModel = speechModel;
        this.voice       = voice;
        this.json        = objectMapper;
        this.http        = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // CapabilityProvider
    // -------------------------------------------------------------------------

    @Override
    public String translate(String text, String sourceLanguage, String targetLanguage) {
        log.debug("Translating {} chars {} → {}", text.length(), sourceLanguage, targetLanguage);
        List<Message> messages = List.of(
                new Message("system", "You are a translator that translates "
                        + sourceLanguage + " to " + targetLanguage + "."),
                new Message("user", "Translate the following text: '" + text
                        + "'. Do not generate any additional text beyond the translation."));
        try {
            String body = json.writeValueAsString(Map.of(
                    "model",    chatModel,
                    "messages", messages));
            HttpResponse<String> resp = http.send(
                    request("/chat/completions", body, Duration.ofSeconds(60)),
                    HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() != 200) {
                throw new CapabilityException(
                        "translate failed — HTTP " + resp.statusCode() + ": " + resp.body());
            }
            String translated = json.readValue(resp.body(), ChatResponse.class).firstContent();
            if (translated == null || translated.isBlank()) {
                throw new CapabilityException("translate returned an empty translation");
            }
            return translated.strip();
        } catch (CapabilityException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapabilityException("translate interrupted", e);
        } catch (Exception e) {
            throw new CapabilityException("translate failed", e);
        }
    }

    @Override
    public byte[] synthesizeSpeech(String text) {
        log.debug("Synthesizing speech for {} chars", text.length());
        try {
            String body = json.writeValueAsString(Map.of(
                    "model", speechModel,
                    "voice", voice,
                    "input", text));
            HttpResponse<byte[]> resp = http.send(
                    request("/audio/speech", body, Duration.ofSeconds(120)),
                    HttpResponse.BodyHandlers.ofByteArray());
            if (resp.statusCode() != 200) {
                throw new CapabilityException(
                        "synthesizeSpeech failed — HTTP " + resp.statusCode() + ": "
                        + new String(resp.body(), StandardCharsets.UTF_8));
            }
            return resp.body();
        } catch (CapabilityException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapabilityException("synthesizeSpeech interrupted", e);
        } catch (Exception e) {
            throw new CapabilityException("synthesizeSpeech failed", e);
        }
    }

    // -------------------------------------------------------------------------
    // Private helpers
    // -------------------------------------------------------------------------

    private HttpRequest request(String path, String jsonBody, Duration timeout) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type",  "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build();
    }
}
