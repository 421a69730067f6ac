package rowset.engine.config;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Persists EngineOptions as a JSON file. Fields missing from the file take their defaults.
 */
public class OptionsStore {
    private static final Logger log = LoggerFactory.getLogger(OptionsStore.class);

    private final Path file;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public OptionsStore(Path file) {
        if (file == null) throw new IllegalArgumentException("file must not be null");
        this.file = file;
    }

    public Path file() { return file; }

    /** Defaults when the file does not exist; IllegalStateException when it cannot be read as options. */
    public EngineOptions load() {
        if (!Files.exists(file)) {
            log.debug("No options file at {}, using defaults", file);
            return EngineOptions.defaults();
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            EngineOptions loaded = gson.fromJson(reader, EngineOptions.class);
            if (loaded == null) return EngineOptions.defaults(); // empty file
            log.debug("Loaded options from {}", file);
            return loaded;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading options file: " + file, e);
        } catch (RuntimeException e) {
            throw new IllegalStateException("Malformed options file: " + file + " (" + e.getMessage() + ")", e);
        }
    }

    public void save(EngineOptions options) {
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) Files.createDirectories(dir);
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                gson.toJson(options, writer);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed saving options file: " + file, e);
        }
        log.debug("Saved options to {}", file);
    }
}
