package com.drover.core.json;

import com.drover.core.model.PlanTask;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import java.util.List;

/**
 * Jackson configuration shared by every wire shape: snake_case names, ISO-8601 instants,
 * lenient about unknown fields.
 */
public final class WireFormat {

    private static final TypeReference<List<PlanTask>> PLAN_TYPE = new TypeReference<>() {};

    private WireFormat() {}

    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new ParameterNamesModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Parses a plan, either a JSON array of tasks or an object with a {@code tasks} array, and
     * fills in omitted ids.
     *
     * @throws IllegalArgumentException if the text is not a valid plan
     */
    public static List<PlanTask> parsePlan(ObjectMapper mapper, String json) {
        try {
            JsonNode root = mapper.readTree(json);
            JsonNode tasks = root != null && root.isObject() ? root.path("tasks") : root;
            if (tasks == null || !tasks.isArray()) {
                throw new IllegalArgumentException("Invalid plan JSON: expected an array of tasks");
            }
            List<PlanTask> plan = mapper.convertValue(tasks, PLAN_TYPE);
            return PlanTask.normalize(plan);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid plan JSON: " + e.getOriginalMessage(), e);
        }
    }
}
