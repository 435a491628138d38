package com.scoutintel.transferroom.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Field-level conversions shared by the record mappers.
 *
 * None of these throw: a value that cannot be converted comes back as null so that
 * one odd field never costs the whole record.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PayloadNormalizer {

    static final Map<String, String> POSITION_NAMES = Map.of(
            "GK", "Goalkeeper",
            "CB", "Centre-Back",
            "LB", "Left-Back",
            "RB", "Right-Back",
            "DM", "Defensive-Midfield",
            "CM", "Central-Midfield",
            "AM", "Attacking-Midfield",
            "W", "Winger",
            "F", "Forward"
    );

    private final ObjectMapper objectMapper;

    /**
     * Expand a position code, e.g. "CB" → "Centre-Back". Unknown codes are returned as given.
     */
    public String positionName(String code) {
        if (code == null || code.isBlank()) return null;
        return POSITION_NAMES.getOrDefault(code, code);
    }

    /**
     * "1995-06-26T00:00:00" → 1995-06-26. A plain date is accepted as well.
     */
    public LocalDate toDate(JsonNode node) {
        String value = text(node);
        if (value == null) return null;
        int timeSeparator = value.indexOf('T');
        String datePart = timeSeparator >= 0 ? value.substring(0, timeSeparator) : value;
        try {
            return LocalDate.parse(datePart);
        } catch (DateTimeParseException e) {
            log.debug("Could not parse date: {}", value);
            return null;
        }
    }

    /**
     * Canonical compact JSON for a nested payload that may arrive either as structure
     * or as a JSON-encoded string. Empty containers and malformed strings give null.
     */
    public String toCanonicalJson(JsonNode node) {
        if (isAbsent(node)) return null;

        JsonNode value = node;
        if (node.isTextual()) {
            String text = node.asText();
            if (text.isBlank()) return null;
            try {
                value = objectMapper.readTree(text);
            } catch (JsonProcessingException e) {
                log.debug("Discarding malformed JSON field: {}", e.getOriginalMessage());
                return null;
            }
            if (isAbsent(value)) return null;
        }
        if (value.isContainerNode() && value.isEmpty()) return null;

        return writeJson(value);
    }

    /**
     * JSON booleans pass through; "true"/"false" strings are read case-insensitively.
     */
    public Boolean toBoolean(JsonNode node) {
        if (isAbsent(node)) return null;
        if (node.isBoolean()) return node.booleanValue();
        if (node.isTextual()) {
            String value = node.asText().trim();
            if (value.equalsIgnoreCase("true")) return Boolean.TRUE;
            if (value.equalsIgnoreCase("false")) return Boolean.FALSE;
        }
        return null;
    }

    public Integer toInteger(JsonNode node) {
        if (isAbsent(node)) return null;
        if (node.isIntegralNumber() && node.canConvertToInt()) return node.intValue();
        if (node.isNumber()) return null;
        String value = text(node);
        if (value == null) return null;
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public BigDecimal toDecimal(JsonNode node) {
        if (isAbsent(node)) return null;
        if (node.isNumber()) return node.decimalValue();
        String value = text(node);
        if (value == null) return null;
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Text of a scalar field; blank and non-scalar values give null.
     */
    public String text(JsonNode node) {
        if (isAbsent(node) || node.isContainerNode()) return null;
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    public String writeJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            log.debug("Could not serialise JSON field: {}", e.getOriginalMessage());
            return null;
        }
    }

    private boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }
}
