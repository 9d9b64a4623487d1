package me.golemcore.invocation.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.invocation.domain.model.Tool;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.WeakHashMap;

/**
 * Validates tool arguments against the tool's JSON schema (draft 2020-12).
 * Compiled schemas are cached per tool instance.
 */
@Slf4j
public class ToolArgumentValidator {

    private final ObjectMapper objectMapper;
    private final JsonSchemaFactory schemaFactory;
    private final Map<Tool, JsonSchema> schemaCache = Collections.synchronizedMap(new WeakHashMap<>());

    public ToolArgumentValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    }

    /**
     * @return validation messages, empty when the arguments are valid
     */
    public List<String> validate(Tool tool, Map<String, Object> arguments) {
        JsonSchema schema;
        try {
            schema = schemaCache.computeIfAbsent(tool, this::compile);
        } catch (RuntimeException e) {
            log.warn("[Tools] Invalid input schema for '{}': {}", tool.getName(), e.getMessage());
            return List.of("Invalid input schema: " + e.getMessage());
        }
        JsonNode node;
        try {
            node = objectMapper.valueToTree(arguments != null ? arguments : Map.of());
        } catch (IllegalArgumentException e) {
            log.warn("[Tools] Arguments for '{}' cannot be serialized: {}", tool.getName(), e.getMessage());
            return List.of("Arguments cannot be serialized: " + e.getMessage());
        }
        Set<ValidationMessage> messages = schema.validate(node);
        if (messages.isEmpty()) {
            return List.of();
        }
        List<String> errors = messages.stream().map(ValidationMessage::getMessage).toList();
        log.debug("[Tools] Arguments for '{}' failed validation: {}", tool.getName(), errors);
        return errors;
    }

    private JsonSchema compile(Tool tool) {
        JsonNode schemaNode = objectMapper.valueToTree(tool.getInputSchema());
        if (schemaNode instanceof ObjectNode objectNode) {
            objectNode.remove("$schema");
        }
        return schemaFactory.getSchema(schemaNode);
    }
}
