package utils;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

public class UtilsJson {

    /**
     * Safely gets a string value from JSON, returns null if not present
     */
    public static String getJsonString(JsonObject json, String key) {
        if (json == null || !json.has(key)) {
            return null;
        }
        return asString(json.get(key));
    }

    /**
     * Safely gets an integer value from JSON, returns null if not present or not numeric
     */
    public static Integer getJsonInt(JsonObject json, String key) {
        if (json == null || !json.has(key)) {
            return null;
        }
        return asInteger(json.get(key));
    }

    /**
     * Safely gets a boolean value from JSON, returns null if not present
     */
    public static Boolean getJsonBoolean(JsonObject json, String key) {
        if (json == null || !json.has(key)) {
            return null;
        }
        JsonElement element = json.get(key);
        if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isBoolean()) {
            return element.getAsBoolean();
        }
        return null;
    }

    /**
     * Safely gets a nested object, returns null if the key is missing or not an object
     */
    public static JsonObject getJsonObject(JsonObject json, String key) {
        if (json == null || !json.has(key) || !json.get(key).isJsonObject()) {
            return null;
        }
        return json.getAsJsonObject(key);
    }

    /**
     * Safely gets a nested array, returns null if the key is missing or not an array
     */
    public static JsonArray getJsonArray(JsonObject json, String key) {
        if (json == null || !json.has(key) || !json.get(key).isJsonArray()) {
            return null;
        }
        return json.getAsJsonArray(key);
    }

    /**
     * Converts a primitive element to its string form. Objects, arrays and JSON null give null.
     */
    public static String asString(JsonElement element) {
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        return element.getAsString();
    }

    /**
     * Converts a number or a numeric string to an Integer, returns null otherwise.
     * Fractional numbers are truncated.
     */
    public static Integer asInteger(JsonElement element) {
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isNumber()) {
            return (int) primitive.getAsDouble();
        }
        if (primitive.isString()) {
            return parseInteger(primitive.getAsString());
        }
        return null;
    }

    /**
     * Converts a number or a numeric string to a Long, returns null otherwise.
     */
    public static Long asLong(JsonElement element) {
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isNumber()) {
            return (long) primitive.getAsDouble();
        }
        if (primitive.isString()) {
            try {
                return (long) Double.parseDouble(primitive.getAsString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Parses an integer from text, accepting values like "7" or "7.0". Returns null when blank or invalid.
     */
    public static Integer parseInteger(String text) {
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            try {
                return (int) Double.parseDouble(text.trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
    }
}
