package io.regrada.core.graph;

import java.util.List;
import java.util.Objects;

/// Value type carried by an input event.
///
/// Primitive names follow the choreography language: `Integer`, `String`,
/// `Boolean`, `Float` and `Array`. A record is an ordered list of named
/// fields, each with a primitive type.
///
/// @see Event#getValueType()
public sealed interface ValueType permits ValueType.Unit, ValueType.Primitive, ValueType.Record {

    String UNIT = "Unit";
    String RECORD = "Record";

    /// Returns the type name as stored in project files.
    ///
    /// @return `Unit`, `Record`, or the primitive name, never null
    String typeName();

    /// Event with no payload.
    record Unit() implements ValueType {

        @Override
        public String typeName() {
            return UNIT;
        }
    }

    /// Single primitive value.
    ///
    /// @param name primitive type name, not blank
    record Primitive(String name) implements ValueType {

        public Primitive {
            Objects.requireNonNull(name, "name must not be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
        }

        @Override
        public String typeName() {
            return name;
        }
    }

    /// Record of named fields.
    ///
    /// @param fields ordered fields, not empty
    record Record(List<Field> fields) implements ValueType {

        public Record {
            Objects.requireNonNull(fields, "fields must not be null");
            if (fields.isEmpty()) {
                throw new IllegalArgumentException("record must declare at least one field");
            }
            fields = List.copyOf(fields);
        }

        @Override
        public String typeName() {
            return RECORD;
        }
    }

    /// Named record field.
    ///
    /// @param name field name, not null
    /// @param type primitive type name, not null
    record Field(String name, String type) {

        public Field {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    static ValueType unit() {
        return new Unit();
    }

    static ValueType primitive(String name) {
        return UNIT.equals(name) ? new Unit() : new Primitive(name);
    }
}
