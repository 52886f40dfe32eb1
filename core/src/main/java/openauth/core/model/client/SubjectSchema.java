package openauth.core.model.client;

/**
 * Validates the {@code properties} claim of an access token for one subject type.
 *
 * <p>Implementations receive the raw claim value (usually a {@code Map}) and return either the
 * validated, possibly converted, value or a list of issues.
 */
@FunctionalInterface
public interface SubjectSchema {

    SchemaResult validate(Object properties);
}
