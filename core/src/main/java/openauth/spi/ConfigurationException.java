package openauth.spi;

/**
 * Exception thrown when a component is constructed with unusable configuration.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
