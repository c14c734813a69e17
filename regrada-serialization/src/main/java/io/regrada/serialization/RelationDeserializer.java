package io.regrada.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.regrada.core.graph.Relation;
import io.regrada.core.graph.RelationKind;
import java.io.IOException;
import java.io.Serial;

/// Reads a project-file edge into a [Relation].
///
/// The stored `id` is ignored; the id is derived from kind and endpoints.
///
/// @implNote Package-private. Registered by [RegradaJacksonModule].
class RelationDeserializer extends StdDeserializer<Relation> {

    @Serial private static final long serialVersionUID = -7504115386702298342L;

    RelationDeserializer() {
        super(Relation.class);
    }

    @Override
    public Relation deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        String source = root.path("source").asText("");
        String target = root.path("target").asText("");
        if (source.isEmpty() || target.isEmpty()) {
            throw JsonMappingException.from(p, "Edge " + root.path("id").asText("?") + " needs a source and a target");
        }
        RelationKind kind;
        try {
            kind = RelationKind.fromJsonName(root.path("type").asText(""));
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
        return Relation.of(kind, source, target, root.path("data").path("guard").asText(""));
    }
}
