package com.taskrelay.orchestrator.publisher;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Publishes artifacts to IPFS through Pinata's pinFileToIPFS endpoint.
 *
 * The locator handed back is the public gateway URL for the pinned CID, so
 * callers can fetch the artifact without Pinata credentials.
 */
@Component
public class PinataArtifactPublisher implements ArtifactPublisher {

    private static final Logger log = LoggerFactory.getLogger(PinataArtifactPublisher.class);

    private static final Map<String, String> EXTENSIONS = Map.of(
            "audio/mpeg", "mp3",
            "text/plain", "txt",
            "application/json", "json");

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PinResponse(@JsonProperty("IpfsHash") String ipfsHash,
                              @JsonProperty("PinSize")  long pinSize) {}

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiUrl;
    private final String       apiKey;
    private final String       apiSecret;
    private final String       gatewayTemplate;

    public PinataArtifactPublisher(
            @Value("${taskrelay.pinata.api-url:https://api.pinata.cloud}") String apiUrl,
            @Value("${taskrelay.pinata.api-key:}") String apiKey,
            @Value("${taskrelay.pinata.api-secret:}") String apiSecret,
            @Value("${taskrelay.pinata.gateway:https://gateway.pinata.cloud/ipfs/{CID}}") String gatewayTemplate,
            ObjectMapper objectMapper) {
        this.apiUrl          = apiUrl;
        this.apiKey          = apiKey;
        this.apiSecret       = apiSecret;
        this.gatewayTemplate = gatewayTemplate;
        this.json            = objectMapper;
        this.http            = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String publish(byte[] content, String contentType) {
        String filename = "artifact-" + UUID.randomUUID() + "." + EXTENSIONS.getOrDefault(contentType, "bin");
        String boundary = "----taskrelay" + UUID.randomUUID().toString().replace("-", "");
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl + "/pinning/pinFileToIPFS"))
                    .timeout(Duration.ofSeconds(120))
                    .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                    .header("pinata_api_key",        apiKey)
                    .header("pinata_secret_api_key", apiSecret)
                    .POST(HttpRequest.BodyPublishers.ofByteArray(
                            multipartBody(boundary, filename, contentType, content)))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new PublishException(
                        "pinFileToIPFS failed — HTTP " + resp.statusCode() + ": " + resp.body());
            }
            PinResponse pin = json.readValue(resp.body(), PinResponse.class);
            if (pin.ipfsHash() == null || pin.ipfsHash().isBlank()) {
                throw new PublishException("pinFileToIPFS returned no IpfsHash");
            }
            log.info("Pinned {} ({} bytes) as {}", filename, content.length, pin.ipfsHash());
            return locatorFor(pin.ipfsHash());
        } catch (PublishException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException("pinFileToIPFS interrupted", e);
        } catch (Exception e) {
            throw new PublishException("Failed to upload file to Pinata", e);
        }
    }

    /** Public gateway URL for a content identifier. */
    public String locatorFor(String cid) {
        return gatewayTemplate.replace("{CID}", cid);
    }

    private static byte[] multipartBody(String boundary, String filename,
                                        String contentType, byte[] content) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(content.length + 256);
        String head = "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"file\"; filename=\"" + filename + "\"\r\n"
                + "Content-Type: " + contentType + "\r\n\r\n";
        out.writeBytes(head.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(content);
        out.writeBytes(("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
        return out.toByteArray();
    }
}
