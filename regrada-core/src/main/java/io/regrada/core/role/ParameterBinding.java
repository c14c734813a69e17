package io.regrada.core.role;

import java.util.Objects;

/// One parameter binding inside a role expression.
///
/// | form | text |
/// |---|---|
/// | [Bound] | `id=1`, `id='x'`, `id=A` |
/// | [Declared] | `#id`, `#id as A` |
/// | [Wildcard] | `id=*` |
public sealed interface ParameterBinding
        permits ParameterBinding.Bound, ParameterBinding.Declared, ParameterBinding.Wildcard {

    String name();

    /// Parameter fixed to a value or to a shared variable.
    record Bound(String name, String value) implements ParameterBinding {
        public Bound {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /// Parameter introduced by the initiating side, optionally named as a shared variable.
    ///
    /// @param alias shared variable name, null when not shared
    record Declared(String name, String alias) implements ParameterBinding {
        public Declared {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /// Parameter matching any value.
    record Wildcard(String name) implements ParameterBinding {
        public Wildcard {
            Objects.requireNonNull(name, "name must not be null");
        }
    }
}
