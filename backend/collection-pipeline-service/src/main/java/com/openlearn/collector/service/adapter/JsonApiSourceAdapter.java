package com.openlearn.collector.service.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openlearn.collector.entity.SourceKind;
import com.openlearn.collector.exception.ItemValidationException;
import com.openlearn.collector.service.SourceDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generic JSON API adapter.
 * Accepts a top-level array, an object with a {@code data}/{@code items}/{@code results}
 * array, or a single object.
 */
@Slf4j
public class JsonApiSourceAdapter extends AbstractHttpSourceAdapter {

    private static final List<String> ENVELOPE_FIELDS = List.of("data", "items", "results");

    private final ObjectMapper objectMapper;

    public JsonApiSourceAdapter(SourceDefinition source, WebClient webClient, ObjectMapper objectMapper, Clock clock) {
        super(source, webClient, clock);
        this.objectMapper = objectMapper;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.API;
    }

    @Override
    public List<RawItem> fetch() {
        String body = get(source.url());
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw ItemValidationException.unparseable(source.key(), e);
        }

        LocalDateTime fetchedAt = now();
        List<RawItem> items = new ArrayList<>();
        for (JsonNode element : elements(root)) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("source", source.key());
            payload.put("data", objectMapper.convertValue(element, new TypeReference<Object>() {}));
            payload.put("extracted_at", fetchedAt.toString());
            items.add(new RawItem(source.key(), SourceKind.API, fetchedAt, payload));
        }
        log.debug("Fetched {} API items from {}", items.size(), source.key());
        return items;
    }

    private List<JsonNode> elements(JsonNode root) {
        List<JsonNode> result = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(result::add);
            return result;
        }
        if (root.isObject()) {
            for (String field : ENVELOPE_FIELDS) {
                JsonNode envelope = root.get(field);
                if (envelope != null && envelope.isArray()) {
                    envelope.forEach(result::add);
                    return result;
                }
            }
            result.add(root);
            return result;
        }
        throw new ItemValidationException("Unexpected JSON root type " + root.getNodeType(), source.key());
    }
}
