package orbit.backup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import orbit.manager.client.ManagerClient;
import orbit.manager.model.NamedResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Archive of the manager's device templates and config-groups: one pretty-printed JSON file
 * per item under {@code templates/} and {@code config_groups/}.
 *
 * Restore creates only items whose name does not exist on the manager yet.
 */
public class ManagerCatalogArchive implements ConfigurationArchive {

    private static final Logger log = LoggerFactory.getLogger(ManagerCatalogArchive.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static final String TEMPLATE_TAG = "template_device";
    public static final String CONFIG_GROUP_TAG = "config_group";

    static final String TEMPLATES_DIR = "templates";
    static final String CONFIG_GROUPS_DIR = "config_groups";

    private final ManagerClient client;

    public ManagerCatalogArchive(ManagerClient client) {
        this.client = client;
    }

    @Override
    public boolean backup(Path workdir, List<String> tags, boolean saveRunning) {
        if (saveRunning) {
            log.info("Running configuration is not part of the catalog archive, skipping");
        }
        if (selected(tags, TEMPLATE_TAG)) {
            int saved = save(workdir.resolve(TEMPLATES_DIR), client.listTemplates(), this::templateDefinition);
            log.info("Backed up {} device template(s)", saved);
        }
        if (selected(tags, CONFIG_GROUP_TAG)) {
            int saved = save(workdir.resolve(CONFIG_GROUPS_DIR), client.listConfigGroups(), NamedResource::definition);
            log.info("Backed up {} config-group(s)", saved);
        }
        return true;
    }

    @Override
    public boolean restore(Path workdir, List<String> tags, boolean attach) {
        if (selected(tags, TEMPLATE_TAG)) {
            int created = load(workdir.resolve(TEMPLATES_DIR), client::listTemplates, client::createTemplate);
            log.info("Restored {} device template(s)", created);
        }
        if (selected(tags, CONFIG_GROUP_TAG)) {
            int created = load(workdir.resolve(CONFIG_GROUPS_DIR), client::listConfigGroups, client::createConfigGroup);
            log.info("Restored {} config-group(s)", created);
        }
        if (attach) {
            log.info("Attachment of restored items is left to device onboarding");
        }
        return true;
    }

    private static boolean selected(List<String> tags, String tag) {
        return tags.contains(ALL) || tags.contains(tag);
    }

    /** The catalog listing only carries summaries; the definition is read per template */
    private JsonNode templateDefinition(NamedResource template) {
        if (template.id() == null) {
            return null;
        }
        return client.getTemplateDefinition(template.id());
    }

    private int save(Path dir, List<NamedResource> items, Function<NamedResource, JsonNode> definitions) {
        try {
            Files.createDirectories(dir);
            Set<String> written = new HashSet<>();
            int saved = 0;
            for (NamedResource item : items) {
                JsonNode definition = definitions.apply(item);
                if (definition == null) {
                    log.debug("No definition returned for '{}', skipping", item.name());
                    continue;
                }
                String file = fileName(item.name());
                if (!written.add(file)) {
                    String unique = fileName(item.name() + "-" + (item.id() != null ? item.id() : saved));
                    log.warn("'{}' maps to {} which is already taken, saving as {}", item.name(), file, unique);
                    file = unique;
                    written.add(file);
                }
                MAPPER.writeValue(dir.resolve(file).toFile(), definition);
                saved++;
            }
            return saved;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + dir, e);
        }
    }

    private int load(Path dir, Supplier<List<NamedResource>> existing, Consumer<JsonNode> create) {
        if (!Files.isDirectory(dir)) {
            log.debug("Nothing to restore in {}", dir);
            return 0;
        }
        Set<String> names = existing.get().stream().map(NamedResource::name).collect(Collectors.toCollection(HashSet::new));
        int created = 0;
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.filter(f -> f.toString().endsWith(".json")).sorted().collect(Collectors.toList())) {
                JsonNode definition = MAPPER.readTree(file.toFile());
                String name = definitionName(definition);
                if (name != null && names.contains(name)) {
                    log.debug("'{}' already exists on manager, skipping", name);
                    continue;
                }
                create.accept(definition);
                created++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + dir, e);
        }
        return created;
    }

    private static String definitionName(JsonNode definition) {
        for (String field : List.of("templateName", "name")) {
            JsonNode value = definition.get(field);
            if (value != null && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }

    static String fileName(String name) {
        return name.replaceAll("[^A-Za-z0-9._-]", "_") + ".json";
    }
}
