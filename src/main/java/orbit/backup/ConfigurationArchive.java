package orbit.backup;

import java.nio.file.Path;
import java.util.List;

/**
 * Engine that serializes manager configuration (templates, config-groups) to a working
 * directory and back.
 */
public interface ConfigurationArchive {

    /** Tag selecting every supported item type */
    String ALL = "all";

    /**
     * @param tags        item types to back up, {@link #ALL} for everything
     * @param saveRunning also save running configuration where the engine supports it
     * @return true if the backup completed
     */
    boolean backup(Path workdir, List<String> tags, boolean saveRunning);

    /**
     * @param attach also attach restored items to devices where the engine supports it
     * @return true if the restore completed
     */
    boolean restore(Path workdir, List<String> tags, boolean attach);
}
