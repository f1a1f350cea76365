package orbit.error;

public class TemplateNotFoundException extends ConfigurationException {

    public TemplateNotFoundException(String templateName) {
        super("Device template '" + templateName + "' not found in manager");
    }
}
