package openauth.core.model.client;

import java.util.List;

/**
 * Outcome of validating subject properties against a {@link SubjectSchema}.
 */
public sealed interface SchemaResult {

    record Valid(Object value) implements SchemaResult {}

    record Issues(List<String> issues) implements SchemaResult {
        public Issues {
            issues = List.copyOf(issues);
        }
    }

    static SchemaResult valid(Object value) {
        return new Valid(value);
    }

    static SchemaResult issues(String... issues) {
        return new Issues(List.of(issues));
    }
}
