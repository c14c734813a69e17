package io.regrada.serialization.compile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.regrada.core.compile.CompileError;
import io.regrada.core.compile.CompileOutcome;
import io.regrada.core.compile.CompileResponseParser;
import io.regrada.core.compile.CompileServiceException;
import io.regrada.core.projection.model.Projection;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Jackson-based implementation of [CompileResponseParser].
///
/// Reads the array returned by the compile service's projections endpoint.
/// An empty array means the service has not finished yet. The first entry
/// carrying a `compileError` turns the whole response into
/// [CompileOutcome.Failed]; otherwise every entry is read as a [Projection].
///
/// The mapper must have [io.regrada.serialization.RegradaJacksonModule]
/// registered, as the one from [io.regrada.serialization.ProjectSerializer#createMapper()] does.
///
/// @implNote Thread-safe if the supplied [ObjectMapper] is thread-safe.
///
/// @see CompileResponseParser for the interface contract
public class JacksonCompileResponseParser implements CompileResponseParser {

    private final ObjectMapper objectMapper;

    /// Creates a parser backed by the given Jackson mapper.
    ///
    /// @param objectMapper mapper with the Regrada module registered, not null
    public JacksonCompileResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public Optional<CompileOutcome> parse(String content) throws CompileServiceException {
        Objects.requireNonNull(content, "content must not be null");

        try {
            JsonNode root = objectMapper.readTree(content);
            if (root == null || !root.isArray()) {
                throw new CompileServiceException("Compile response is not a JSON array");
            }
            if (root.isEmpty()) {
                return Optional.empty();
            }

            for (JsonNode entry : root) {
                if (entry.has("compileError")) {
                    CompileError error = objectMapper.treeToValue(entry, CompileError.class);
                    return Optional.of(new CompileOutcome.Failed(error));
                }
            }

            List<Projection> projections = new ArrayList<>(root.size());
            for (JsonNode entry : root) {
                projections.add(objectMapper.treeToValue(entry, Projection.class));
            }
            return Optional.of(new CompileOutcome.Completed(projections));
        } catch (JsonProcessingException e) {
            throw new CompileServiceException("Failed to parse compile response: " + e.getMessage(), e);
        }
    }
}
