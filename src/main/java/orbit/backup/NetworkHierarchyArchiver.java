package orbit.backup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import orbit.manager.client.ManagerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Backs up and restores MRF regions and subregions of the network hierarchy.
 *
 * Only available on manager 20.7 and later. Everything here is best-effort: failures are
 * logged as warnings and never abort the surrounding backup or restore.
 */
public class NetworkHierarchyArchiver {

    private static final Logger log = LoggerFactory.getLogger(NetworkHierarchyArchiver.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    static final String REGION = "REGION";
    static final String SUB_REGION = "SUB_REGION";

    private static final int MIN_MAJOR = 20;
    private static final int MIN_MINOR = 7;

    private final ManagerClient client;

    public NetworkHierarchyArchiver(ManagerClient client) {
        this.client = client;
    }

    /**
     * Write regions to {@code mrf/regions} and subregions to {@code mrf/subregions}.
     */
    public void backup(Path workdir) {
        try {
            if (!isSupported()) {
                log.debug("Manager version < {}.{}, skipping MRF backup", MIN_MAJOR, MIN_MINOR);
                return;
            }

            log.info("Backing up MRF regions and subregions...");
            List<JsonNode> hierarchy = client.getNetworkHierarchy();

            List<JsonNode> regions = withLabel(hierarchy, REGION);
            List<JsonNode> subregions = withLabel(hierarchy, SUB_REGION);

            if (regions.isEmpty()) {
                log.debug("No MRF regions found");
                return;
            }

            Path regionsDir = Files.createDirectories(workdir.resolve("mrf").resolve("regions"));
            int savedRegions = 0;
            for (JsonNode region : regions) {
                if (region.path("data").path("hierarchyId").path("regionId").asInt() == 0) {
                    continue;
                }
                write(regionsDir, projectRegion(region));
                savedRegions++;
            }

            if (!subregions.isEmpty()) {
                Path subregionsDir = Files.createDirectories(workdir.resolve("mrf").resolve("subregions"));
                for (JsonNode subregion : subregions) {
                    write(subregionsDir, projectSubregion(subregion));
                }
            }

            log.info("Backed up {} regions and {} subregions", savedRegions, subregions.size());

        } catch (IOException | RuntimeException e) {
            log.warn("Error backing up MRF regions: {}", e.getMessage());
        }
    }

    /**
     * Recreate regions, then subregions, each directory in sorted file-name order.
     */
    public void restore(Path workdir) {
        Path mrfDir = workdir.resolve("mrf");
        if (!Files.isDirectory(mrfDir)) {
            log.debug("No MRF backup found, skipping");
            return;
        }

        try {
            if (!isSupported()) {
                log.debug("Manager version < {}.{}, skipping MRF restore", MIN_MAJOR, MIN_MINOR);
                return;
            }

            log.info("Restoring MRF regions and subregions...");
            restoreDirectory(mrfDir.resolve("regions"), "region");
            restoreDirectory(mrfDir.resolve("subregions"), "subregion");
            log.info("MRF restore completed");

        } catch (IOException | RuntimeException e) {
            log.warn("Error restoring MRF regions: {}", e.getMessage());
        }
    }

    private void restoreDirectory(Path dir, String kind) throws IOException {
        if (!Files.isDirectory(dir)) {
            return;
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing.filter(f -> f.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .collect(Collectors.toList());
        }
        for (Path file : files) {
            JsonNode node = MAPPER.readTree(file.toFile());
            String name = node.path("name").asText(file.getFileName().toString());
            try {
                client.createNetworkHierarchyNode(node);
                log.debug("Restored {}: {}", kind, name);
            } catch (RuntimeException e) {
                log.warn("Error restoring {} {}: {}", kind, name, e.getMessage());
            }
        }
    }

    /**
     * True when the reported server version is at least 20.7.
     */
    boolean isSupported() {
        String version = client.serverVersion();
        String[] parts = version == null ? new String[0] : version.trim().split("\\.");
        if (parts.length < 2) {
            throw new IllegalStateException("Unrecognized manager version: " + version);
        }
        int major = Integer.parseInt(parts[0].replaceAll("\\D", ""));
        int minor = Integer.parseInt(parts[1].replaceAll("\\D", ""));
        return major > MIN_MAJOR || (major == MIN_MAJOR && minor >= MIN_MINOR);
    }

    private static List<JsonNode> withLabel(List<JsonNode> hierarchy, String label) {
        List<JsonNode> matching = new ArrayList<>();
        for (JsonNode node : hierarchy) {
            if (label.equals(node.path("data").path("label").asText())) {
                matching.add(node);
            }
        }
        return matching;
    }

    private static ObjectNode projectRegion(JsonNode region) {
        ObjectNode out = base(region);
        ObjectNode data = (ObjectNode) out.get("data");
        data.putObject("hierarchyId").set("regionId", region.path("data").path("hierarchyId").get("regionId"));
        if (region.path("data").has("isSecondary")) {
            data.set("isSecondary", region.path("data").get("isSecondary"));
        }
        return out;
    }

    private static ObjectNode projectSubregion(JsonNode subregion) {
        ObjectNode out = base(subregion);
        ObjectNode data = (ObjectNode) out.get("data");
        data.putObject("hierarchyId").set("subRegionId", subregion.path("data").path("hierarchyId").get("subRegionId"));
        return out;
    }

    private static ObjectNode base(JsonNode node) {
        ObjectNode out = MAPPER.createObjectNode();
        out.set("name", node.get("name"));
        out.set("uuid", node.get("uuid"));
        if (node.has("description")) {
            out.set("description", node.get("description"));
        }
        ObjectNode data = out.putObject("data");
        data.set("parentUuid", node.path("data").get("parentUuid"));
        data.set("label", node.path("data").get("label"));
        return out;
    }

    private static void write(Path dir, ObjectNode node) throws IOException {
        MAPPER.writeValue(dir.resolve(node.path("name").asText() + ".json").toFile(), node);
    }
}
