package com.chunkvault.core.cache;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Sizes values by their JSON form: two bytes per character, with shortcuts for
 * strings (2 × length), numbers (8), booleans (4) and byte arrays (their length).
 */
public class JsonSizeEstimator implements SizeEstimator<Object> {

    private final ObjectMapper mapper;

    public JsonSizeEstimator(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public long estimateSize(Object value) throws Exception {
        if (value instanceof CharSequence text) {
            return 2L * text.length();
        }
        if (value instanceof Number) {
            return 8;
        }
        if (value instanceof Boolean) {
            return 4;
        }
        if (value instanceof byte[] bytes) {
            return bytes.length;
        }
        return 2L * mapper.writeValueAsString(value).length();
    }
}
