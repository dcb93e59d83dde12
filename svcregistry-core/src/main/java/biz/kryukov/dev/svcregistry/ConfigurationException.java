package biz.kryukov.dev.svcregistry;

/**
 * Invalid registry configuration (missing services, unparsable URLs, unknown protocols).
 */
public class ConfigurationException extends ServiceRegistryException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
