package com.adlanda.dailytoon.service;

import com.adlanda.dailytoon.exception.ExtractionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a JSON object out of free-form text-model output.
 *
 * Candidates are tried in order, the first that parses to an object wins:
 * <ol>
 *   <li>the first fenced block tagged {@code json}</li>
 *   <li>the first fenced block with any or no tag</li>
 *   <li>the whole text</li>
 *   <li>the span from the first '{' to the last '}'</li>
 * </ol>
 * Parsing is strict: trailing tokens and non-object roots are rejected.
 */
@Service
public class ResponseExtractor {

    private static final Logger log = LoggerFactory.getLogger(ResponseExtractor.class);

    // ```tag\n body ```
    private static final Pattern FENCE = Pattern.compile("```([A-Za-z0-9_+-]*)[ \\t]*\\r?\\n?(.*?)```", Pattern.DOTALL);

    private final ObjectReader reader;

    public ResponseExtractor(ObjectMapper objectMapper) {
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Extracts the JSON object embedded in a model response.
     *
     * @param rawText The raw response text
     * @return The parsed object
     * @throws ExtractionException if no candidate parses to a JSON object
     */
    public ObjectNode extract(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw new ExtractionException(rawText);
        }

        for (String candidate : candidates(rawText)) {
            Optional<ObjectNode> parsed = parseObject(candidate);
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }

        log.debug("No JSON object found in {} chars of model output", rawText.length());
        throw new ExtractionException(rawText);
    }

    private List<String> candidates(String rawText) {
        List<String> candidates = new ArrayList<>();

        String firstFence = null;
        String jsonFence = null;
        Matcher matcher = FENCE.matcher(rawText);
        while (matcher.find()) {
            String tag = matcher.group(1).toLowerCase(Locale.ROOT);
            String body = matcher.group(2);
            if (firstFence == null) {
                firstFence = body;
            }
            if (jsonFence == null && tag.equals("json")) {
                jsonFence = body;
            }
        }
        if (jsonFence != null) {
            candidates.add(jsonFence);
        }
        if (firstFence != null && !firstFence.equals(jsonFence)) {
            candidates.add(firstFence);
        }

        candidates.add(rawText.trim());

        int start = rawText.indexOf('{');
        int end = rawText.lastIndexOf('}');
        if (start >= 0 && end > start) {
            candidates.add(rawText.substring(start, end + 1));
        }
        return candidates;
    }

    private Optional<ObjectNode> parseObject(String candidate) {
        String text = candidate.trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonNode node = reader.readTree(text);
            if (node instanceof ObjectNode object) {
                return Optional.of(object);
            }
            return Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
