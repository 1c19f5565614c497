package com.gt.studyscheduler.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gt.studyscheduler.exception.MappingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Encodes stored collections as JSON arrays. Every date is written as an ISO-8601 string and parsed back into an
 * {@link java.time.Instant} with millisecond precision intact.
 */
@Component
public class StudyStateCodec {

    private static final Logger log = LoggerFactory.getLogger(StudyStateCodec.class);

    private final ObjectMapper objectMapper;

    public StudyStateCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public <T> String encodeList(List<T> records) {
        try {
            return objectMapper.writeValueAsString(records);
        } catch (JsonProcessingException ex) {
            throw new MappingException("Unable to encode " + records.size() + " records", ex);
        }
    }

    /**
     * Decodes a JSON array. A value that is not an array raises {@link MappingException}; an element that cannot be
     * mapped to {@code recordType} is logged and skipped.
     */
    public <T> List<T> decodeList(String encoded, Class<T> recordType) {
        JsonNode root;
        try {
            root = objectMapper.readTree(encoded);
        } catch (JsonProcessingException ex) {
            throw new MappingException("Stored " + recordType.getSimpleName() + " data is not valid JSON", ex);
        }

        if (root == null || !root.isArray()) {
            throw new MappingException("Stored " + recordType.getSimpleName() + " data is not a JSON array");
        }

        List<T> records = new ArrayList<>(root.size());
        for (int index = 0; index < root.size(); index++) {
            if (!root.get(index).isObject()) {
                log.warn("Skipping {} record at index {}, not a JSON object", recordType.getSimpleName(), index);
                continue;
            }

            try {
                records.add(objectMapper.treeToValue(root.get(index), recordType));
            } catch (JsonProcessingException | IllegalArgumentException ex) {
                log.warn("Skipping corrupt {} record at index {}: {}", recordType.getSimpleName(), index, ex.getMessage());
            }
        }

        return records;
    }
}
