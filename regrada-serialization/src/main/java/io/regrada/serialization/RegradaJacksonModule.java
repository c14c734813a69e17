package io.regrada.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.regrada.core.compile.CompileError;
import io.regrada.core.graph.Relation;
import io.regrada.core.graph.Role;
import io.regrada.core.project.Project;
import io.regrada.core.projection.model.DataType;
import io.regrada.core.projection.model.Expression;
import io.regrada.core.projection.model.Projection;
import io.regrada.core.projection.model.RoleExpr;
import java.io.Serial;
import java.util.Objects;

/// Jackson `SimpleModule` that registers every ReGraDa codec in one place.
///
/// **Project file** (read and written):
/// - `Project` - `ProjectDocumentSerializer` / `ProjectDocumentDeserializer`
/// - `Relation` - `RelationSerializer` / `RelationDeserializer`, edge shape with a `"type"` discriminator
/// - `Role` - `RoleSerializer` / `RoleDeserializer`
///
/// **Compile-service payloads** (read only, single-key tagged objects):
/// - `Projection` - `ProjectionDeserializer`
/// - `Expression` - `ExpressionDeserializer`
/// - `RoleExpr` - `RoleExprDeserializer`
/// - `DataType` - `DataTypeDeserializer`
/// - `CompileError` - `CompileErrorDeserializer`
///
/// @implNote All registrations are explicit; nothing relies on reflection over core types.
/// @see ProjectSerializer for the convenience factory API
public class RegradaJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4127730981726530122L;

    /// Constructs the module writing [ProjectFormat#FULL] project files.
    public RegradaJacksonModule() {
        this(ProjectFormat.FULL);
    }

    /// Constructs the module.
    ///
    /// @param format project file variant to write, not null
    public RegradaJacksonModule(ProjectFormat format) {
        super("RegradaJacksonModule");
        Objects.requireNonNull(format, "format must not be null");

        addSerializer(Project.class, new ProjectDocumentSerializer(format));
        addDeserializer(Project.class, new ProjectDocumentDeserializer());

        addSerializer(Relation.class, new RelationSerializer());
        addDeserializer(Relation.class, new RelationDeserializer());

        addSerializer(Role.class, new RoleSerializer());
        addDeserializer(Role.class, new RoleDeserializer());

        addDeserializer(Projection.class, new ProjectionDeserializer());
        addDeserializer(Expression.class, new ExpressionDeserializer());
        addDeserializer(RoleExpr.class, new RoleExprDeserializer());
        addDeserializer(DataType.class, new DataTypeDeserializer());
        addDeserializer(CompileError.class, new CompileErrorDeserializer());
    }
}
