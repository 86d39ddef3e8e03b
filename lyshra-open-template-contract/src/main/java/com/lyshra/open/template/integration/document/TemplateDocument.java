package com.lyshra.open.template.integration.document;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Opaque structured document carried through template migrations.
 *
 * <p>The content is a JSON object tree. Instances are immutable: every accessor hands out a
 * deep copy and every modifier returns a new document, so a migration step can never alter
 * the state an earlier step or a backup observed.</p>
 */
public final class TemplateDocument {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectNode content;

    private TemplateDocument(ObjectNode content) {
        this.content = content;
    }

    public static TemplateDocument empty() {
        return new TemplateDocument(MAPPER.createObjectNode());
    }

    public static TemplateDocument of(ObjectNode content) {
        Objects.requireNonNull(content, "content");
        return new TemplateDocument(content.deepCopy());
    }

    /**
     * Builds a document from plain Java values (maps, lists, strings, numbers, booleans).
     *
     * @param values top-level fields
     * @return document
     */
    public static TemplateDocument fromMap(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        return new TemplateDocument(MAPPER.valueToTree(values));
    }

    /**
     * Returns a mutable deep copy of the content.
     *
     * @return copy of the object tree
     */
    public ObjectNode getContent() {
        return content.deepCopy();
    }

    public Optional<JsonNode> get(String field) {
        JsonNode value = content.get(field);
        return value == null ? Optional.empty() : Optional.of(value.deepCopy());
    }

    public boolean has(String field) {
        return content.has(field);
    }

    public TemplateDocument with(String field, Object value) {
        ObjectNode copy = content.deepCopy();
        copy.set(field, MAPPER.valueToTree(value));
        return new TemplateDocument(copy);
    }

    public TemplateDocument without(String field) {
        ObjectNode copy = content.deepCopy();
        copy.remove(field);
        return new TemplateDocument(copy);
    }

    public Map<String, Object> toMap() {
        return MAPPER.convertValue(content, MAP_TYPE);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TemplateDocument)) return false;
        return content.equals(((TemplateDocument) o).content);
    }

    @Override
    public int hashCode() {
        return content.hashCode();
    }

    @Override
    public String toString() {
        return content.toString();
    }
}
