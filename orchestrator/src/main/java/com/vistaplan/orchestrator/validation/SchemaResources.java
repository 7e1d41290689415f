package com.vistaplan.orchestrator.validation;

import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.List;

/** Loads the bundled JSON schemas from {@code classpath:schemas/}. */
final class SchemaResources {

    private static final JsonSchemaFactory FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private SchemaResources() {}

    static JsonSchema load(String name) {
        String path = "schemas/" + name;
        try (InputStream in = SchemaResources.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Schema not found on classpath: " + path);
            }
            return FACTORY.getSchema(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read schema " + path, e);
        }
    }

    /** Messages in a stable order, so logs and verdicts do not reshuffle between runs. */
    static List<String> messages(Collection<ValidationMessage> found) {
        return found.stream()
                .map(ValidationMessage::getMessage)
                .sorted()
                .toList();
    }
}
