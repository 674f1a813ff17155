package com.example.examSchedulerBackend.service.vision;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Base64;
import java.util.Locale;

/**
 * Chat-completions call against an OpenAI-compatible endpoint with one image
 * attached, bound to a single model.
 */
public class GroqVisionBackend implements VisionBackend {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final RestClient restClient;
    private final String model;
    private final String prompt;
    private final int maxTokens;

    public GroqVisionBackend(RestClient restClient, String model, String prompt, int maxTokens) {
        this.restClient = restClient;
        this.model = model;
        this.prompt = prompt;
        this.maxTokens = maxTokens;
    }

    @Override
    public String getName() {
        return model;
    }

    @Override
    public String analyze(byte[] image, String mimeType) {
        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .body(buildRequest(image, mimeType))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException e) {
            String body = e.getResponseBodyAsString();
            boolean unsupported = e.getStatusCode().value() == 400
                    && body.toLowerCase(Locale.ROOT).contains("model");
            throw new VisionBackendException(model, "HTTP " + e.getStatusCode().value() + ": " + body, unsupported, e);
        } catch (RestClientException e) {
            throw new VisionBackendException(model, e.getMessage(), false, e);
        }

        JsonNode content = response == null ? null
                : response.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual() || content.asText().isBlank()) {
            throw new VisionBackendException(model, "Response carried no message content", false);
        }
        return content.asText();
    }

    ObjectNode buildRequest(byte[] image, String mimeType) {
        ObjectNode request = MAPPER.createObjectNode();
        request.put("model", model);
        ArrayNode content = request.putArray("messages").addObject()
                .put("role", "user")
                .putArray("content");
        content.addObject()
                .put("type", "text")
                .put("text", prompt);
        content.addObject()
                .put("type", "image_url")
                .putObject("image_url")
                .put("url", "data:" + mimeType + ";base64," + Base64.getEncoder().encodeToString(image));
        request.put("max_tokens", maxTokens);
        return request;
    }
}
