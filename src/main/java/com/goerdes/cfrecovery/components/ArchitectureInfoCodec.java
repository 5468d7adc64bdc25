package com.goerdes.cfrecovery.components;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goerdes.cfrecovery.exception.AnalysisException;
import com.goerdes.cfrecovery.model.ArchitectureInfo;
import com.goerdes.cfrecovery.model.ArchitectureType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads and writes {@link ArchitectureInfo} descriptors as JSON, e.g.
 * <pre>{"arch":"x86","big_endian":false,"canary":true,"stripped":false,"bits_64":true}</pre>
 * Missing keys default to an unknown architecture and {@code false} flags;
 * an unrecognised architecture name is read as unknown.
 */
@Component
public class ArchitectureInfoCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String ARCH = "arch";
    private static final String BIG_ENDIAN = "big_endian";
    private static final String CANARY = "canary";
    private static final String STRIPPED = "stripped";
    private static final String BITS_64 = "bits_64";

    /**
     * @param json the descriptor as JSON object
     * @return the parsed descriptor
     * @throws AnalysisException if the JSON is malformed or a flag is not a boolean
     */
    public ArchitectureInfo read(String json) {
        Map<String, Object> raw = parseRawJson(json);
        return new ArchitectureInfo(
                parseArch(raw.get(ARCH)),
                flag(raw, BIG_ENDIAN),
                flag(raw, CANARY),
                flag(raw, STRIPPED),
                flag(raw, BITS_64)
        );
    }

    public String write(ArchitectureInfo info) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put(ARCH, info.arch().name().toLowerCase(Locale.ROOT));
        raw.put(BIG_ENDIAN, info.bigEndian());
        raw.put(CANARY, info.hasCanary());
        raw.put(STRIPPED, info.stripped());
        raw.put(BITS_64, info.is64bit());
        try {
            return MAPPER.writeValueAsString(raw);
        } catch (JsonProcessingException e) {
            throw new AnalysisException("Error writing architecture descriptor", e);
        }
    }

    /** Deserialize a single JSON object into a raw Map. */
    private Map<String, Object> parseRawJson(String json) {
        try {
            Map<String, Object> raw = MAPPER.readValue(json, new TypeReference<>() {});
            if (raw == null) {
                throw new AnalysisException("Architecture descriptor is empty", null);
            }
            return raw;
        } catch (JsonProcessingException e) {
            throw new AnalysisException("Error reading architecture descriptor: " + e.getOriginalMessage(), e);
        }
    }

    private static ArchitectureType parseArch(Object value) {
        if (value == null) {
            return ArchitectureType.UNKNOWN;
        }
        try {
            return ArchitectureType.valueOf(value.toString().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ArchitectureType.UNKNOWN;
        }
    }

    private static boolean flag(Map<String, Object> raw, String key) {
        Object value = raw.get(key);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        throw new AnalysisException("'" + key + "' must be a boolean, got: " + value, null);
    }
}
