package io.kneo.programmer.service.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.kneo.programmer.service.exceptions.ValidationError;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class DslParser {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<LinkedHashMap<String, Object>> TREE_TYPE = new TypeReference<>() {
    };

    private DslParser() {
    }

    public static Map<String, Object> parse(String yamlText) {
        try {
            Map<String, Object> tree = YAML_MAPPER.readValue(yamlText, TREE_TYPE);
            if (tree == null) {
                throw new ValidationError(List.of("Schedule definition is empty"));
            }
            return tree;
        } catch (JsonProcessingException e) {
            throw new ValidationError(List.of("Schedule definition is not valid YAML: " + e.getOriginalMessage()));
        }
    }
}
