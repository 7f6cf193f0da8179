package io.feydor.inspo.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;
import io.feydor.inspo.midi.SysexHandling;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads {@link InspoSettings} from a JSON file such as:
 * <pre>
 * {
 *   "sysexHandling": "LEGACY",
 *   "seed": 42,
 *   "showFeatures": true,
 *   "showJson": false,
 *   "verbose": false
 * }
 * </pre>
 * Every key is optional. Keys that are absent keep the value of the settings passed in.
 */
public class SettingsLoader {
    private static final Logger LOGGER = Logger.getLogger(SettingsLoader.class.getName());
    /** Looked up in the working directory when no file is given */
    public static final String DEFAULT_SETTINGS_FILE = "midi-inspo.json";
    private static final Set<String> KNOWN_KEYS = Set.of("sysexHandling", "seed", "showFeatures", "showJson", "verbose");

    private SettingsLoader() {}

    /**
     * Loads {@value #DEFAULT_SETTINGS_FILE} from the working directory if it exists
     */
    public static InspoSettings loadDefaultFile(InspoSettings base) {
        File file = new File(DEFAULT_SETTINGS_FILE);
        if (!file.exists()) {
            LOGGER.log(Level.FINE, "No settings file at {0}, using defaults", file.getAbsolutePath());
            return base;
        }
        return load(file, base);
    }

    /**
     * @throws SettingsException When the file is missing, unreadable or not a settings object
     */
    public static InspoSettings load(File file, InspoSettings base) {
        if (!file.isFile()) {
            throw new SettingsException("Settings file not found: " + file.getAbsolutePath());
        }
        try (InputStream inputStream = Files.newInputStream(file.toPath())) {
            var settings = load(new InputStreamReader(inputStream, StandardCharsets.UTF_8), base);
            LOGGER.log(Level.INFO, "Loaded settings from {0}", file.getAbsolutePath());
            return settings;
        } catch (IOException e) {
            throw new SettingsException("Failed to read settings file: " + file.getAbsolutePath(), e);
        }
    }

    public static InspoSettings load(Reader reader, InspoSettings base) {
        Map<String, Object> jsonMap;
        try {
            TypeToken<Map<String, Object>> typeToken = new TypeToken<>() {};
            Gson gson = new GsonBuilder()
                    .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
                    .create();
            jsonMap = gson.fromJson(reader, typeToken);
        } catch (JsonParseException e) {
            throw new SettingsException("Settings are not valid JSON: " + e.getMessage(), e);
        }

        if (jsonMap == null) {
            return base;
        }

        for (var key : jsonMap.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                LOGGER.log(Level.WARNING, "Ignoring unknown setting: {0}", key);
            }
        }

        var settings = base;
        if (jsonMap.get("sysexHandling") != null) {
            settings = settings.withSysexHandling(parseSysexHandling(jsonMap.get("sysexHandling")));
        }
        if (jsonMap.get("seed") != null) {
            settings = settings.withSeed(asLong("seed", jsonMap.get("seed")));
        }
        if (jsonMap.get("showFeatures") != null) {
            settings = settings.withShowFeatures(asBoolean("showFeatures", jsonMap.get("showFeatures")));
        }
        if (jsonMap.get("showJson") != null) {
            settings = settings.withShowJson(asBoolean("showJson", jsonMap.get("showJson")));
        }
        if (jsonMap.get("verbose") != null) {
            settings = settings.withVerbose(asBoolean("verbose", jsonMap.get("verbose")));
        }
        return settings;
    }

    private static SysexHandling parseSysexHandling(Object value) {
        try {
            return SysexHandling.valueOf(String.valueOf(value).trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new SettingsException("sysexHandling must be one of SKIP_PAYLOAD or LEGACY. Given: " + value, e);
        }
    }

    // Whole numbers arrive as Long, anything with a fraction or exponent as Double
    private static long asLong(String key, Object value) {
        if (value instanceof Long number) {
            return number;
        }
        throw new SettingsException(key + " must be a whole number. Given: " + value);
    }

    private static boolean asBoolean(String key, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        throw new SettingsException(key + " must be true or false. Given: " + value);
    }
}
