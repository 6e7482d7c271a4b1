package quire;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import quire.utils.Log;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.util.Locale;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Config {
    public String version = "0.1.0";
    public int port = 63790;
    public int databases = 16;
    public boolean appendOnly = false;
    public String appendFilename = "quire.aof";
    public int replBacklogSize = 1024 * 1024; // 1MB
    public boolean debug = false;

    public Config() {
        // Default constructor for Jackson
    }

    public static Config load(String filename) {
        File f = new File(filename);
        if (!f.exists() && filename.endsWith(".conf")) {
            File yamlFile = new File(filename.replace(".conf", ".yaml"));
            if (yamlFile.exists()) f = yamlFile;
        }

        Config config = new Config();

        if (!f.exists()) {
            Log.warn("Config file not found: " + filename + ". Using defaults.");
            return applyEnvironment(config);
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            config = mapper.readValue(f, Config.class);
            if (config == null) config = new Config();
        } catch (Exception e) {
            Log.warn("Failed to load config as YAML (" + e.getMessage() + "). Attempting legacy parse...");
            config = loadLegacy(f, new Config());
        }

        return applyEnvironment(config);
    }

    private static Config applyEnvironment(Config config) {
        if (System.getenv("QUIRE_VERSION") != null) {
            config.version = System.getenv("QUIRE_VERSION");
        }
        return config;
    }

    // Plain "key value" lines, as in a redis.conf.
    static Config loadLegacy(File f, Config config) {
        try (BufferedReader br = new BufferedReader(new FileReader(f))) {
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] parts = line.split("\\s+", 2);
                if (parts.length < 2) continue;

                String key = parts[0].toLowerCase(Locale.ROOT);
                String val = parts[1].trim();

                switch (key) {
                    case "port": config.port = Integer.parseInt(val); break;
                    case "databases": config.databases = Integer.parseInt(val); break;
                    case "appendonly": config.appendOnly = val.equalsIgnoreCase("yes") || val.equalsIgnoreCase("true"); break;
                    case "appendfilename": config.appendFilename = val.replace("\"", ""); break;
                    case "repl-backlog-size": config.replBacklogSize = (int) parseMemory(val); break;
                    case "debug": config.debug = val.equalsIgnoreCase("yes") || val.equalsIgnoreCase("true"); break;
                    default: Log.debug("Ignoring unknown config key: " + key);
                }
            }
            Log.info("Loaded legacy config.");
        } catch (Exception e) {
            Log.error("Error loading legacy config: " + e.getMessage());
        }
        return config;
    }

    static long parseMemory(String val) {
        val = val.toUpperCase(Locale.ROOT);
        long factor = 1;
        if (val.endsWith("GB")) { factor = 1024 * 1024 * 1024L; val = val.replace("GB", ""); }
        else if (val.endsWith("MB")) { factor = 1024 * 1024L; val = val.replace("MB", ""); }
        else if (val.endsWith("KB")) { factor = 1024L; val = val.replace("KB", ""); }
        try {
            return Long.parseLong(val.trim()) * factor;
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
