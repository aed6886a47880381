package com.pulseflow.pulseflow_backend.model.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores node types under their editor wire names and reads back aliases such as "swapPLS".
 * A tag with no matching type loads as null so the engine rejects the graph as a structural error.
 */
@Slf4j
@Converter
public class NodeTypeConverter implements AttributeConverter<NodeType, String> {

    @Override
    public String convertToDatabaseColumn(NodeType attribute) {
        return attribute == null ? null : attribute.getWireName();
    }

    @Override
    public NodeType convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return NodeType.fromWireName(dbData.trim());
        } catch (IllegalArgumentException e) {
            log.warn("Stored node type '{}' is not supported: {}", dbData, e.getMessage());
            return null;
        }
    }
}
