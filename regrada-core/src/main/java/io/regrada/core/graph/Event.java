package io.regrada.core.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Immutable choreography event.
///
/// An event is owned by exactly one scope, named by [#getParent()]. Its label
/// is the short name used by relation lines and must be unique within the
/// owning scope. Input events carry a [ValueType]; computation events carry an
/// expression string.
///
/// ### Defaults
/// - label: the id
/// - name: the label
/// - marking: [Marking#DEFAULT]
/// - value type (input): [ValueType.Unit]
/// - expression (computation): empty
/// - parent: [Scope#GLOBAL_ID]
///
/// @implNote Immutable and thread-safe after construction.
public final class Event {

    private final String id;
    private final String label;
    private final String name;
    private final EventKind kind;
    private final ValueType valueType;
    private final String expression;
    private final List<String> initiators;
    private final List<String> receivers;
    private final String security;
    private final Marking marking;
    private final String parent;

    private Event(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Event ID required");
        this.kind = Objects.requireNonNull(builder.kind, "Event kind required");
        this.label = builder.label == null || builder.label.isBlank() ? id : builder.label;
        this.name = builder.name == null || builder.name.isBlank() ? label : builder.name;
        if (kind == EventKind.INPUT) {
            this.valueType = builder.valueType == null ? ValueType.unit() : builder.valueType;
            this.expression = "";
        } else {
            this.valueType = null;
            this.expression = builder.expression == null ? "" : builder.expression;
        }
        this.initiators = List.copyOf(builder.initiators);
        this.receivers = List.copyOf(builder.receivers);
        this.security = builder.security == null ? "" : builder.security;
        this.marking = builder.marking == null ? Marking.DEFAULT : builder.marking;
        this.parent = builder.parent == null ? Scope.GLOBAL_ID : builder.parent;

        validate();
    }

    private void validate() {
        if (label.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalStateException("Event label '" + label + "' must not contain whitespace");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .label(label)
                .name(name)
                .kind(kind)
                .valueType(valueType)
                .expression(expression)
                .initiators(initiators)
                .receivers(receivers)
                .security(security)
                .marking(marking)
                .parent(parent);
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public String getName() {
        return name;
    }

    public EventKind getKind() {
        return kind;
    }

    /// Returns the payload type of an input event.
    ///
    /// @return value type, or null for computation events
    public ValueType getValueType() {
        return valueType;
    }

    /// Returns the expression of a computation event.
    ///
    /// @return expression text, empty for input events, never null
    public String getExpression() {
        return expression;
    }

    public List<String> getInitiators() {
        return initiators;
    }

    public List<String> getReceivers() {
        return receivers;
    }

    public String getSecurity() {
        return security;
    }

    public Marking getMarking() {
        return marking;
    }

    /// Returns the owning scope id.
    ///
    /// @return scope id, [Scope#GLOBAL_ID] for top-level events, never null
    public String getParent() {
        return parent;
    }

    public boolean isInput() {
        return kind == EventKind.INPUT;
    }

    public Event withParent(String newParent) {
        return toBuilder().parent(newParent).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Event other)) {
            return false;
        }
        return id.equals(other.id)
                && label.equals(other.label)
                && name.equals(other.name)
                && kind == other.kind
                && Objects.equals(valueType, other.valueType)
                && expression.equals(other.expression)
                && initiators.equals(other.initiators)
                && receivers.equals(other.receivers)
                && security.equals(other.security)
                && marking.equals(other.marking)
                && parent.equals(other.parent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, kind, parent);
    }

    @Override
    public String toString() {
        return "Event{id=" + id + ", label=" + label + ", name=" + name + ", parent=" + parent + "}";
    }

    public static final class Builder {
        private String id;
        private String label;
        private String name;
        private EventKind kind = EventKind.INPUT;
        private ValueType valueType;
        private String expression;
        private final List<String> initiators = new ArrayList<>();
        private final List<String> receivers = new ArrayList<>();
        private String security;
        private Marking marking;
        private String parent;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder kind(EventKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder valueType(ValueType valueType) {
            this.valueType = valueType;
            return this;
        }

        public Builder expression(String expression) {
            this.expression = expression;
            return this;
        }

        public Builder initiators(List<String> initiators) {
            this.initiators.clear();
            this.initiators.addAll(initiators);
            return this;
        }

        public Builder initiator(String initiator) {
            this.initiators.add(initiator);
            return this;
        }

        public Builder receivers(List<String> receivers) {
            this.receivers.clear();
            this.receivers.addAll(receivers);
            return this;
        }

        public Builder receiver(String receiver) {
            this.receivers.add(receiver);
            return this;
        }

        public Builder security(String security) {
            this.security = security;
            return this;
        }

        public Builder marking(Marking marking) {
            this.marking = marking;
            return this;
        }

        public Builder parent(String parent) {
            this.parent = parent;
            return this;
        }

        public Event build() {
            return new Event(this);
        }
    }
}
