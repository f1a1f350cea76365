package orbit.onboarding.inventory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import orbit.error.InventoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Reads and writes device inventory files.
 * YAML by default, JSON when the file name ends in {@code .json}.
 */
public final class InventoryLoader {

    private static final Logger log = LoggerFactory.getLogger(InventoryLoader.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES))
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private InventoryLoader() {
    }

    /**
     * Load an inventory file.
     *
     * @throws InventoryException if the file is missing or invalid
     */
    public static DeviceInventory load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new InventoryException("File not found: " + path);
        }
        log.info("Loading device inventory from {}", path);
        try {
            return mapperFor(path).readValue(path.toFile(), DeviceInventory.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new InventoryException("Invalid device inventory " + path + ": " + rootMessage(e), e);
        }
    }

    /**
     * Build an inventory from already-parsed data.
     */
    public static DeviceInventory fromMap(Map<String, ?> data) {
        try {
            return JSON.convertValue(data, DeviceInventory.class);
        } catch (IllegalArgumentException e) {
            throw new InventoryException("Invalid device inventory: " + rootMessage(e), e);
        }
    }

    /**
     * Write an inventory so that {@link #load(Path)} reproduces it.
     */
    public static void write(DeviceInventory inventory, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapperFor(path).writeValue(path.toFile(), inventory);
        } catch (IOException e) {
            throw new InventoryException("Failed to write device inventory " + path + ": " + e.getMessage(), e);
        }
    }

    private static ObjectMapper mapperFor(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".json") ? JSON : YAML;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
