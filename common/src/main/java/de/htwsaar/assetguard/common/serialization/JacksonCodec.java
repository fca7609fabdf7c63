package de.htwsaar.assetguard.common.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Map;

public final class JacksonCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    static {
        MAPPER.registerModule(new JavaTimeModule());
        MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    private JacksonCodec() {
        // Utility
    }

    public static String toJson(Object obj) {
        try {
            return MAPPER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new AssetGuardSerializationException("Failed to serialize object to JSON", e);
        }
    }

    /**
     * Serialisiert eingerückt, damit Build-Artefakte im Diff lesbar bleiben.
     */
    public static String toPrettyJson(Object obj) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new AssetGuardSerializationException("Failed to serialize object to JSON", e);
        }
    }

    /**
     * Liest ein flaches JSON-Objekt mit String-Werten.
     *
     * @param json JSON-Text, z. B. {@code {"css/app.css":"css/app.1a2b3c4d.css"}}
     * @return unveränderte Reihenfolge wie im Dokument
     * @throws AssetGuardSerializationException bei ungültigem JSON, {@code null} oder Nicht-Objekt
     */
    public static Map<String, String> fromJsonStringMap(String json) {
        if (json == null || json.isBlank()) {
            throw new AssetGuardSerializationException("Empty JSON document");
        }
        try {
            Map<String, String> map = MAPPER.readValue(json, STRING_MAP);
            if (map == null) {
                throw new AssetGuardSerializationException("JSON document is null, expected an object");
            }
            return map;
        } catch (JsonProcessingException e) {
            throw new AssetGuardSerializationException("Failed to deserialize JSON to a string map", e);
        }
    }
}
