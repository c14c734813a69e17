package io.regrada.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.regrada.core.graph.Role;
import io.regrada.core.graph.RoleParameter;
import java.io.IOException;
import java.io.Serial;

/// Writes a [Role] as
/// `{"role": "Prosumer", "label": "P", "types": [{"var": "id", "type": "Integer"}], "participants": ["P(id=1)"]}`.
///
/// `role` is the display name and `label` the short label used in role expressions.
///
/// @implNote Package-private. Registered by [RegradaJacksonModule].
class RoleSerializer extends StdSerializer<Role> {

    @Serial private static final long serialVersionUID = 5521308830466237109L;

    RoleSerializer() {
        super(Role.class);
    }

    @Override
    public void serialize(Role role, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("role", role.name());
        gen.writeStringField("label", role.label());
        gen.writeArrayFieldStart("types");
        for (RoleParameter parameter : role.parameters()) {
            gen.writeStartObject();
            gen.writeStringField("var", parameter.name());
            gen.writeStringField("type", parameter.type());
            gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeArrayFieldStart("participants");
        for (String participant : role.participants()) {
            gen.writeString(participant);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}
