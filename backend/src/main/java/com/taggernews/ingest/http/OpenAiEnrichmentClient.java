package com.taggernews.ingest.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taggernews.config.IngestionProperties;
import com.taggernews.ingest.error.EnrichmentCallException;
import com.taggernews.ingest.model.StoryEnrichment;
import com.taggernews.ingest.model.StoryRecord;
import com.taggernews.ingest.taxonomy.TagTaxonomy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Enrichment through an OpenAI compatible {@code /chat/completions} endpoint using JSON mode.
 * The whole batch goes into a single prompt and the model answers with one entry per story id.
 */
@Service
public class OpenAiEnrichmentClient implements EnrichmentClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAiEnrichmentClient.class);

    private static final String SYSTEM_PROMPT = """
        You summarize and tag Hacker News stories. Answer with a JSON object of the form
        {"stories": [{"id": <story id>, "summary": "<2-3 sentences>", "tags": {"l1": [], "l2": [], "l3": []}}]}
        with exactly one entry per story you were given.
        """;

    private final IngestionProperties.Enrichment properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public OpenAiEnrichmentClient(IngestionProperties properties, ObjectMapper objectMapper) {
        this.properties = properties.getEnrichment();
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(this.properties.getTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    @Override
    public String modelName() {
        return properties.getModel();
    }

    @Override
    public List<StoryEnrichment> enrich(List<StoryRecord> stories) {
        if (stories == null || stories.isEmpty()) {
            return List.of();
        }
        String requestBody = buildRequest(stories);
        HttpRequest request = HttpRequest.newBuilder(URI.create(endpoint()))
            .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
            .header("Authorization", "Bearer " + properties.getApiKey())
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(requestBody, StandardCharsets.UTF_8))
            .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new EnrichmentCallException("enrichment call timed out", e);
        } catch (IOException e) {
            throw new EnrichmentCallException("enrichment call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EnrichmentCallException("enrichment call interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new EnrichmentCallException("enrichment service returned HTTP " + response.statusCode());
        }
        List<StoryEnrichment> results = parseResponse(response.body());
        log.debug("Enrichment returned {}/{} stories", results.size(), stories.size());
        return results;
    }

    String buildRequest(List<StoryRecord> stories) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", properties.getModel());
        ObjectNode format = root.putObject("response_format");
        format.put("type", "json_object");
        ArrayNode messages = root.putArray("messages");
        ObjectNode system = messages.addObject();
        system.put("role", "system");
        system.put("content", SYSTEM_PROMPT);
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        user.put("content", userPrompt(stories));
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new EnrichmentCallException("could not serialize enrichment request", e);
        }
    }

    private String userPrompt(List<StoryRecord> stories) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("For each story provide a concise 2-3 sentence summary and tags by level.\n\n");
        prompt.append("L1 (broad categories, pick 1-2): ").append(String.join(", ", TagTaxonomy.LEVEL_ONE)).append('\n');
        prompt.append("L2 (topics, pick 2-4 from any category):\n");
        for (Map.Entry<String, List<String>> entry : TagTaxonomy.LEVEL_TWO_BY_CATEGORY.entrySet()) {
            prompt.append("  - ").append(entry.getKey()).append(": ")
                .append(String.join(", ", entry.getValue())).append('\n');
        }
        prompt.append("L3 (specific, pick 0-2): broad names for companies and products, no version numbers.\n\n");
        for (StoryRecord story : stories) {
            prompt.append("id: ").append(story.externalId()).append('\n');
            prompt.append("title: ").append(story.title()).append('\n');
            prompt.append("url: ").append(story.url() == null ? "No URL provided" : story.url()).append("\n\n");
        }
        return prompt.toString();
    }

    List<StoryEnrichment> parseResponse(String body) {
        JsonNode content;
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode message = root.path("choices").path(0).path("message").path("content");
            if (!message.isTextual()) {
                throw new EnrichmentCallException("enrichment response has no message content");
            }
            content = objectMapper.readTree(message.asText());
        } catch (JsonProcessingException e) {
            throw new EnrichmentCallException("enrichment response is not valid JSON", e);
        }
        JsonNode entries = content.path("stories");
        if (!entries.isArray()) {
            throw new EnrichmentCallException("enrichment response has no stories array");
        }
        List<StoryEnrichment> results = new ArrayList<>();
        for (JsonNode entry : entries) {
            JsonNode id = entry.get("id");
            String summary = entry.path("summary").asText("");
            if (id == null || (!id.canConvertToLong() && !id.isTextual()) || summary.isBlank()) {
                continue;
            }
            long externalId;
            try {
                externalId = id.isTextual() ? Long.parseLong(id.asText().trim()) : id.asLong();
            } catch (NumberFormatException e) {
                log.debug("Skipping enrichment entry with id {}", id.asText());
                continue;
            }
            JsonNode tags = entry.path("tags");
            results.add(new StoryEnrichment(
                externalId,
                summary.trim(),
                readTags(tags, "l1", "l1_tags"),
                readTags(tags, "l2", "l2_tags"),
                readTags(tags, "l3", "l3_tags")
            ));
        }
        return results;
    }

    private List<String> readTags(JsonNode tags, String key, String alternateKey) {
        JsonNode node = tags.has(key) ? tags.get(key) : tags.path(alternateKey);
        if (!node.isArray()) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        node.forEach(value -> {
            String name = value.asText("").trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        });
        return names.stream().distinct().collect(Collectors.toList());
    }

    private String endpoint() {
        String base = properties.getBaseUrl();
        if (base == null || base.isBlank()) {
            base = "https://api.openai.com/v1";
        }
        return (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + "/chat/completions";
    }
}
