package openauth.core.model.oauth;

/**
 * The authenticated principal carried by a verified access token.
 *
 * @param type       subject type, used to select the validating schema
 * @param properties validated properties, as produced by the schema
 */
public record Subject(String type, Object properties) {

    /**
     * Return the properties cast to the type the schema for {@link #type()} produces.
     *
     * @throws ClassCastException if the properties are of another type
     */
    public <T> T propertiesAs(Class<T> propertiesType) {
        return propertiesType.cast(properties);
    }
}
