package com.vistaplan.orchestrator.phase;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vistaplan.orchestrator.model.StepOutput;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Reads and writes a run's step-output document: a JSON object keyed by step
 * number whose values are {@link StepOutput} variants.
 */
@Component
public class StepOutputCodec {

    private static final TypeReference<TreeMap<Integer, StepOutput>> DOCUMENT = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public StepOutputCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public SortedMap<Integer, StepOutput> read(String json) {
        if (json == null || json.isBlank()) return new TreeMap<>();
        try {
            return objectMapper.readValue(json, DOCUMENT);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt step-output document: " + e.getOriginalMessage(), e);
        }
    }

    public String write(SortedMap<Integer, StepOutput> outputs) {
        try {
            return objectMapper.writeValueAsString(outputs);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize step outputs", e);
        }
    }

    /**
     * Document with {@code output} recorded under its step. Per-unit outputs
     * (renders, panoramas) are merged into what the step already holds; every
     * other variant replaces it.
     */
    public String withOutput(String json, StepOutput output) {
        SortedMap<Integer, StepOutput> outputs = read(json);
        StepOutput existing = outputs.get(output.step());
        outputs.put(output.step(), merge(existing, output));
        return write(outputs);
    }

    static StepOutput merge(StepOutput existing, StepOutput incoming) {
        if (existing instanceof StepOutput.SpaceRenders prev && incoming instanceof StepOutput.SpaceRenders next) {
            return new StepOutput.SpaceRenders(union(prev.artifactsByUnit(), next.artifactsByUnit()));
        }
        if (existing instanceof StepOutput.Panoramas prev && incoming instanceof StepOutput.Panoramas next) {
            return new StepOutput.Panoramas(union(prev.artifactsByUnit(), next.artifactsByUnit()));
        }
        return incoming;
    }

    private static Map<String, UUID> union(Map<String, UUID> a, Map<String, UUID> b) {
        Map<String, UUID> out = new HashMap<>(a);
        out.putAll(b);
        return out;
    }
}
