package orbit.backup;

import orbit.error.BackupException;
import orbit.error.RestoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Backup and restore of manager configuration: the archive engine plus the
 * version-gated MRF region step.
 */
public class ConfigurationManager {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationManager.class);

    private final ConfigurationArchive archive;
    private final NetworkHierarchyArchiver hierarchy;

    public ConfigurationManager(ConfigurationArchive archive, NetworkHierarchyArchiver hierarchy) {
        this.archive = archive;
        this.hierarchy = hierarchy;
    }

    /**
     * Back up to {@code workdir}, creating it if needed.
     *
     * @param tags archive tags, empty for everything
     * @throws BackupException if the archive step fails
     */
    public boolean backup(Path workdir, List<String> tags, boolean saveRunning, boolean backupMrf) {
        List<String> effectiveTags = tags.isEmpty() ? List.of(ConfigurationArchive.ALL) : tags;
        log.info("Starting backup to {}", workdir);

        try {
            Files.createDirectories(workdir);
            boolean archived = archive.backup(workdir, effectiveTags, saveRunning);
            if (!archived) {
                throw new BackupException("Backup failed: archive engine reported failure", null);
            }

            if (backupMrf) {
                hierarchy.backup(workdir);
            }

            log.info("Backup completed successfully");
            return true;

        } catch (BackupException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new BackupException("Backup failed: " + e.getMessage(), e);
        }
    }

    /**
     * Restore from {@code workdir}. MRF regions go first so that restored items can refer to them.
     *
     * @throws RestoreException if the directory is missing or the archive step fails
     */
    public boolean restore(Path workdir, List<String> tags, boolean attach, boolean restoreMrf) {
        if (!Files.isDirectory(workdir)) {
            throw new RestoreException("Backup directory not found: " + workdir);
        }
        List<String> effectiveTags = tags.isEmpty() ? List.of(ConfigurationArchive.ALL) : tags;
        log.info("Starting restore from {}", workdir);

        try {
            if (restoreMrf) {
                hierarchy.restore(workdir);
            }

            boolean restored = archive.restore(workdir, effectiveTags, attach);
            if (!restored) {
                throw new RestoreException("Restore failed: archive engine reported failure");
            }

            log.info("Restore completed successfully");
            return true;

        } catch (RestoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RestoreException("Restore failed: " + e.getMessage(), e);
        }
    }
}
