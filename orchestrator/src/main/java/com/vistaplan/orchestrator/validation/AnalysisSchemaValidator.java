package com.vistaplan.orchestrator.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;

import java.util.List;

/**
 * Strict structural check of a space-analysis document against
 * {@code schemas/space-analysis.schema.json}, the same schema the generation
 * service is asked to honour. Returns one message per violation; an empty
 * list means the document is valid.
 */
public class AnalysisSchemaValidator {

    static final String SCHEMA = "space-analysis.schema.json";

    private final JsonSchema schema = SchemaResources.load(SCHEMA);

    public List<String> validate(JsonNode doc) {
        return SchemaResources.messages(schema.validate(doc));
    }
}
