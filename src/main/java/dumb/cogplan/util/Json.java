package dumb.cogplan.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import static dumb.cogplan.Log.error;

/** The one mapper for configuration files and exchanged trees. */
public class Json {

    public static final ObjectMapper the = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    /** Indented JSON, or an empty object (logged) when the value cannot be written. */
    public static String str(Object value) {
        try {
            return the.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            error("Cannot write " + value.getClass().getSimpleName() + " as JSON: " + e.getOriginalMessage());
            return "{}";
        }
    }

    public static <T> T obj(String json, Class<T> type) throws JsonProcessingException {
        return the.readValue(json, type);
    }
}
