package orbit.error;

public class ConfigGroupNotFoundException extends ConfigurationException {

    public ConfigGroupNotFoundException(String groupName) {
        super("Configuration group '" + groupName + "' not found in manager. "
                + "Ensure the manager version is 20.12 or higher.");
    }
}
