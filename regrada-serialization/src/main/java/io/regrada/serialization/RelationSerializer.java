package io.regrada.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.regrada.core.graph.Relation;
import java.io.IOException;
import java.io.Serial;

/// Writes a [Relation] as a project-file edge:
/// `{"id": "r-e0-e1", "type": "response", "source": "e0", "target": "e1", "data": {"guard": ""}}`.
///
/// @implNote Package-private. Registered by [RegradaJacksonModule].
class RelationSerializer extends StdSerializer<Relation> {

    @Serial private static final long serialVersionUID = 1830446721556310977L;

    RelationSerializer() {
        super(Relation.class);
    }

    @Override
    public void serialize(Relation relation, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", relation.id());
        gen.writeStringField("type", relation.kind().jsonName());
        gen.writeStringField("source", relation.source());
        gen.writeStringField("target", relation.target());
        gen.writeObjectFieldStart("data");
        gen.writeStringField("guard", relation.guard());
        gen.writeEndObject();
        gen.writeEndObject();
    }
}
