package utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Resolves a field from a JSON payload by trying an ordered list of accessor paths.
 * The first path that leads to a present value wins.
 *
 * Paths use dots for nesting, e.g. "playerRating.playerRankStatus.leagueId".
 * A value is present when it exists, is not JSON null and is not an empty string or empty array.
 * The typed resolvers additionally skip values of the wrong shape and move on to the next path.
 */
public class FieldResolver {

    private final List<String[]> paths;

    private FieldResolver(List<String[]> paths) {
        this.paths = paths;
    }

    /**
     * Creates a resolver from dotted paths in priority order
     * @param dottedPaths The paths to try, highest priority first
     * @return The resolver
     */
    public static FieldResolver of(String... dottedPaths) {
        if (dottedPaths.length == 0) {
            throw new IllegalArgumentException("At least one accessor path is required");
        }
        List<String[]> parsed = new ArrayList<>();
        for (String path : dottedPaths) {
            parsed.add(path.split("\\."));
        }
        return new FieldResolver(Collections.unmodifiableList(parsed));
    }

    /**
     * Returns the first present value, or null when no path matches
     */
    public JsonElement resolve(JsonObject root) {
        for (String[] path : paths) {
            JsonElement value = walk(root, path);
            if (isPresent(value)) {
                return value;
            }
        }
        return null;
    }

    /**
     * Returns the first present primitive as a string, or null
     */
    public String resolveString(JsonObject root) {
        for (String[] path : paths) {
            JsonElement value = walk(root, path);
            if (isPresent(value) && value.isJsonPrimitive()) {
                return value.getAsString();
            }
        }
        return null;
    }

    /**
     * Returns the first value that can be read as an integer, or null
     */
    public Integer resolveInt(JsonObject root) {
        for (String[] path : paths) {
            Integer value = UtilsJson.asInteger(walk(root, path));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * Returns the first value that can be read as a long, or null
     */
    public Long resolveLong(JsonObject root) {
        for (String[] path : paths) {
            Long value = UtilsJson.asLong(walk(root, path));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * Returns the first non-empty array, or null
     */
    public JsonArray resolveArray(JsonObject root) {
        for (String[] path : paths) {
            JsonElement value = walk(root, path);
            if (isPresent(value) && value.isJsonArray()) {
                return value.getAsJsonArray();
            }
        }
        return null;
    }

    /**
     * Returns the first object, or null
     */
    public JsonObject resolveObject(JsonObject root) {
        for (String[] path : paths) {
            JsonElement value = walk(root, path);
            if (isPresent(value) && value.isJsonObject()) {
                return value.getAsJsonObject();
            }
        }
        return null;
    }

    private static JsonElement walk(JsonObject root, String[] path) {
        JsonElement current = root;
        for (String segment : path) {
            if (current == null || !current.isJsonObject()) {
                return null;
            }
            JsonObject object = current.getAsJsonObject();
            if (!object.has(segment)) {
                return null;
            }
            current = object.get(segment);
        }
        return current;
    }

    private static boolean isPresent(JsonElement value) {
        if (value == null || value.isJsonNull()) {
            return false;
        }
        if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isString()) {
            return !value.getAsString().trim().isEmpty();
        }
        if (value.isJsonArray()) {
            return value.getAsJsonArray().size() > 0;
        }
        return true;
    }
}
