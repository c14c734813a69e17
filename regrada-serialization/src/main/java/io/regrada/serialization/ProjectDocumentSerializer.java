package io.regrada.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.regrada.core.graph.Event;
import io.regrada.core.graph.Graph;
import io.regrada.core.graph.IdAllocator;
import io.regrada.core.graph.IdPools;
import io.regrada.core.graph.Marking;
import io.regrada.core.graph.Relation;
import io.regrada.core.graph.Role;
import io.regrada.core.graph.Scope;
import io.regrada.core.graph.ScopeKind;
import io.regrada.core.graph.ValueType;
import io.regrada.core.project.NodeGeometry;
import io.regrada.core.project.Project;
import java.io.IOException;
import java.io.Serial;

/// Writes a [Project] as a project file.
///
/// ```json
/// {
///   "nodes": [{"id": "e0", "type": "event", "parentId": "", "data": {...}}],
///   "edges": [{"id": "c-e0-e1", "type": "condition", "source": "e0", "target": "e1", "data": {"guard": ""}}],
///   "security": "Public flows Public",
///   "roles": [{"role": "Prosumer", "label": "P", "types": [], "participants": []}],
///   "code": "...",
///   "nextNodeId": [2], "nextGroupId": [0], "nextSubprocessId": [0]
/// }
/// ```
///
/// Scope nodes come before event nodes. The global scope is implicit: its
/// children carry an empty `parentId`. `code`, the pool arrays and node
/// geometry are written in [ProjectFormat#FULL] only.
///
/// @implNote Package-private. Registered by [RegradaJacksonModule].
/// @see ProjectDocumentDeserializer for the inverse operation
class ProjectDocumentSerializer extends StdSerializer<Project> {

    @Serial private static final long serialVersionUID = 6290851442710637015L;

    static final String EVENT_NODE = "event";

    private final ProjectFormat format;

    ProjectDocumentSerializer(ProjectFormat format) {
        super(Project.class);
        this.format = format;
    }

    @Override
    public void serialize(Project project, JsonGenerator gen, SerializerProvider provider) throws IOException {
        Graph graph = project.graph();
        gen.writeStartObject();

        gen.writeArrayFieldStart("nodes");
        for (Scope scope : graph.getScopes()) {
            if (!scope.isGlobal()) {
                writeScope(scope, project, gen);
            }
        }
        for (Event event : graph.getEvents()) {
            writeEvent(event, project, gen);
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("edges");
        for (Relation relation : graph.getRelations()) {
            provider.defaultSerializeValue(relation, gen);
        }
        gen.writeEndArray();

        gen.writeStringField("security", graph.getSecurity());

        gen.writeArrayFieldStart("roles");
        for (Role role : graph.getRoles()) {
            provider.defaultSerializeValue(role, gen);
        }
        gen.writeEndArray();

        if (format == ProjectFormat.FULL) {
            gen.writeStringField("code", project.code());
            IdPools pools = graph.getIdPools();
            writePool("nextNodeId", pools.events(), gen);
            writePool("nextGroupId", pools.nests(), gen);
            writePool("nextSubprocessId", pools.subprocesses(), gen);
        }
        gen.writeEndObject();
    }

    private void writeScope(Scope scope, Project project, JsonGenerator gen) throws IOException {
        writeNodeHeader(scope.id(), scope.kind().jsonName(), scope.parent(), project, gen);
        gen.writeObjectFieldStart("data");
        gen.writeStringField("label", scope.label());
        if (scope.kind() == ScopeKind.NEST) {
            gen.writeStringField("nestType", scope.nestMode().jsonName());
        }
        writeMarking(scope.marking(), gen);
        gen.writeEndObject();
        gen.writeEndObject();
    }

    private void writeEvent(Event event, Project project, JsonGenerator gen) throws IOException {
        writeNodeHeader(event.getId(), EVENT_NODE, event.getParent(), project, gen);
        gen.writeObjectFieldStart("data");
        gen.writeStringField("label", event.getLabel());
        gen.writeStringField("name", event.getName());
        gen.writeStringField("type", event.getKind().code());
        writeMarking(event.getMarking(), gen);
        if (event.isInput()) {
            writeInput(event.getValueType(), gen);
        } else {
            gen.writeStringField("expression", event.getExpression());
        }
        writeStrings("initiators", event.getInitiators(), gen);
        writeStrings("receivers", event.getReceivers(), gen);
        gen.writeStringField("security", event.getSecurity());
        gen.writeEndObject();
        gen.writeEndObject();
    }

    /// Opens the node object and writes the fields shared by every node kind.
    private void writeNodeHeader(String id, String type, String parent, Project project, JsonGenerator gen)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", id);
        gen.writeStringField("type", type);
        gen.writeStringField("parentId", Scope.GLOBAL_ID.equals(parent) ? "" : parent);
        NodeGeometry geometry = project.geometry().get(id);
        if (format == ProjectFormat.FULL && geometry != null) {
            if (geometry.position() != null) {
                gen.writeObjectFieldStart("position");
                gen.writeNumberField("x", geometry.position().x());
                gen.writeNumberField("y", geometry.position().y());
                gen.writeEndObject();
            }
            if (geometry.width() != null) {
                gen.writeNumberField("width", geometry.width());
            }
            if (geometry.height() != null) {
                gen.writeNumberField("height", geometry.height());
            }
        }
    }

    private static void writeInput(ValueType type, JsonGenerator gen) throws IOException {
        gen.writeObjectFieldStart("input");
        gen.writeStringField("type", type.typeName());
        if (type instanceof ValueType.Record record) {
            gen.writeArrayFieldStart("record");
            for (ValueType.Field field : record.fields()) {
                gen.writeStartObject();
                gen.writeStringField("var", field.name());
                gen.writeStringField("type", field.type());
                gen.writeEndObject();
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();
    }

    private static void writeMarking(Marking marking, JsonGenerator gen) throws IOException {
        gen.writeObjectFieldStart("marking");
        gen.writeBooleanField("included", marking.included());
        gen.writeBooleanField("pending", marking.pending());
        gen.writeEndObject();
    }

    private static void writeStrings(String field, Iterable<String> values, JsonGenerator gen) throws IOException {
        gen.writeArrayFieldStart(field);
        for (String value : values) {
            gen.writeString(value);
        }
        gen.writeEndArray();
    }

    private static void writePool(String field, IdAllocator pool, JsonGenerator gen) throws IOException {
        gen.writeArrayFieldStart(field);
        for (int suffix : pool.available()) {
            gen.writeNumber(suffix);
        }
        gen.writeEndArray();
    }
}
