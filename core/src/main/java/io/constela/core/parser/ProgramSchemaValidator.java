package io.constela.core.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.PathType;
import com.networknt.schema.SchemaValidatorsConfig;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.constela.core.error.ConstelaError;
import io.constela.core.error.ErrorCode;
import io.constela.core.model.Program;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Structural pre-check of a raw program document against the bundled JSON Schema (draft
 * 2020-12), run before the document is turned into an AST.
 *
 * <p>Only the outer shape is checked: required top-level sections, state field declarations,
 * action/step envelopes and node discriminants. Deep shape problems surface as {@link
 * io.constela.core.error.ProgramParseException} when the AST is built.
 */
public final class ProgramSchemaValidator {

    static final String SCHEMA_RESOURCE = "/schema/constela-program.schema.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final JsonSchema schema;

    public ProgramSchemaValidator() {
        SchemaValidatorsConfig config = new SchemaValidatorsConfig();
        config.setPathType(PathType.JSON_POINTER);
        this.schema = SCHEMA_FACTORY.getSchema(loadSchema(), config);
    }

    /**
     * Validates the raw document.
     *
     * @return {@code SCHEMA_ERROR} entries for shape violations, or a single {@code
     *     UNSUPPORTED_VERSION} entry for a well-formed document with an unknown version; empty when
     *     the document may proceed to parsing
     */
    public List<ConstelaError> validate(JsonNode document) {
        Set<ValidationMessage> messages = schema.validate(document);
        List<ConstelaError> errors = new ArrayList<>();
        messages.stream()
                .sorted(Comparator.comparing(m -> m.getInstanceLocation().toString()))
                .forEach(message -> errors.add(ConstelaError.of(
                        ErrorCode.SCHEMA_ERROR, message.getMessage(), pointer(message))));
        if (errors.isEmpty()) {
            String version = document.path("version").asText();
            if (!Program.SUPPORTED_VERSION.equals(version)) {
                errors.add(ConstelaError.of(
                        ErrorCode.UNSUPPORTED_VERSION,
                        "Unsupported version: '" + version + "'. Supported versions: " + Program.SUPPORTED_VERSION,
                        "/version"));
            }
        }
        return errors;
    }

    private static String pointer(ValidationMessage message) {
        String location = message.getInstanceLocation().toString();
        return location.isEmpty() ? "/" : location;
    }

    private static JsonNode loadSchema() {
        try (InputStream in = ProgramSchemaValidator.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Program schema not found on classpath: " + SCHEMA_RESOURCE);
            }
            return MAPPER.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read program schema " + SCHEMA_RESOURCE, e);
        }
    }
}
