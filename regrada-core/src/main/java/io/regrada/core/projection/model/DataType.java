package io.regrada.core.projection.model;

import io.regrada.core.graph.ValueType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Data type of a compiled event.
public sealed interface DataType permits DataType.Value, DataType.RecordType {

    Map<String, String> PRIMITIVE_NAMES = Map.of(
            "int", "Integer",
            "string", "String",
            "bool", "Boolean",
            "float", "Float",
            "array", "Array");

    /// Converts to the graph model's value type.
    ValueType toValueType();

    /// Primitive or void value type, by service name (`int`, `string`, `void`, ...).
    record Value(String valueType) implements DataType {
        public Value {
            Objects.requireNonNull(valueType, "valueType must not be null");
        }

        @Override
        public ValueType toValueType() {
            if ("void".equals(valueType)) {
                return ValueType.unit();
            }
            return new ValueType.Primitive(primitiveName(valueType));
        }
    }

    record RecordType(List<Field> fields) implements DataType {
        public RecordType {
            fields = List.copyOf(fields);
        }

        @Override
        public ValueType toValueType() {
            if (fields.isEmpty()) {
                return ValueType.unit();
            }
            List<ValueType.Field> converted = new ArrayList<>();
            for (Field field : fields) {
                converted.add(new ValueType.Field(field.name(), primitiveName(field.valueType())));
            }
            return new ValueType.Record(converted);
        }
    }

    record Field(String name, String valueType) {
        public Field {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(valueType, "valueType must not be null");
        }
    }

    static String primitiveName(String serviceName) {
        return PRIMITIVE_NAMES.getOrDefault(serviceName, serviceName);
    }
}
