package utils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Utility class for configuration and environment operations
 */
public class UtilsConfig {

    public static final String ENV_FILE = ".env";

    /**
     * Loads the .env file from the working directory
     * @return The loaded properties, empty if the file does not exist
     * @throws RuntimeException if the file exists but cannot be read
     */
    public static Properties loadEnvFile() {
        return loadEnvFile(Paths.get(ENV_FILE));
    }

    /**
     * Loads a properties-style env file
     * @param envPath The path of the file
     * @return The loaded properties, empty if the file does not exist
     * @throws RuntimeException if the file exists but cannot be read
     */
    public static Properties loadEnvFile(Path envPath) {
        Properties props = new Properties();
        if (!Files.exists(envPath)) {
            return props;
        }
        try (InputStream in = Files.newInputStream(envPath)) {
            props.load(in);
            return props;
        } catch (IOException e) {
            throw new RuntimeException("Failed to load env file: " + envPath, e);
        }
    }

    /**
     * Looks up a setting. Environment variables win over the env file.
     * @param props Values from the env file
     * @param env The process environment
     * @param names The setting name followed by accepted aliases
     * @return The trimmed value, or null if none of the names is set
     */
    public static String getSetting(Properties props, Map<String, String> env, String... names) {
        for (String name : names) {
            String value = env.get(name);
            if (value != null && !value.trim().isEmpty()) {
                return value.trim();
            }
            value = props.getProperty(name);
            if (value != null && !value.trim().isEmpty()) {
                return value.trim();
            }
        }
        return null;
    }

    /**
     * Looks up a mandatory setting
     * @throws IllegalStateException if the setting is missing
     */
    public static String requireSetting(Properties props, Map<String, String> env, String... names) {
        String value = getSetting(props, env, names);
        if (value == null) {
            throw new IllegalStateException(names[0] + " not found in environment or .env file");
        }
        return value;
    }

    /**
     * Splits a comma separated setting into trimmed, non-empty entries
     */
    public static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        if (value == null) {
            return items;
        }
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

    /**
     * Converts an exception's stack trace to a string
     * @param e The exception
     * @return The stack trace as a string
     */
    public static String getStackTraceAsString(Exception e) {
        StringBuilder sb = new StringBuilder();
        sb.append(e.getClass().getName()).append(": ").append(e.getMessage()).append("\n");
        for (StackTraceElement element : e.getStackTrace()) {
            sb.append("  at ").append(element.toString()).append("\n");
        }
        return sb.toString();
    }
}
