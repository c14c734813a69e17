package io.regrada.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.regrada.core.project.Project;

/// Reads and writes ReGraDa project files.
///
/// ### Usage
/// {@snippet :
/// String json = ProjectSerializer.toJson(project);
/// String structure = ProjectSerializer.toJson(project, ProjectFormat.REDUCED);
/// Project restored = ProjectSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. A mapper is created per call via `createMapper()`;
/// cache one for repeated use.
/// @see RegradaJacksonModule for the registered codecs
public final class ProjectSerializer {

    private ProjectSerializer() {}

    /// Serializes a project to pretty-printed JSON in the full format.
    ///
    /// @param project project to write, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Project project) {
        return toJson(project, ProjectFormat.FULL);
    }

    /// Serializes a project in the given format.
    ///
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Project project, ProjectFormat format) {
        try {
            return createMapper(format).writeValueAsString(project);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize project: " + e.getMessage(), e);
        }
    }

    /// Deserializes a project file of either format.
    ///
    /// @param json JSON text, not null
    /// @return project, never null
    /// @throws IllegalArgumentException if the text is not a valid project file
    public static Project fromJson(String json) {
        try {
            return createMapper().readValue(json, Project.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize project: " + e.getMessage(), e);
        }
    }

    /// Creates a mapper writing full project files.
    ///
    /// @return configured mapper, never null
    public static ObjectMapper createMapper() {
        return createMapper(ProjectFormat.FULL);
    }

    /// Creates a mapper with [RegradaJacksonModule], lenient towards unknown
    /// properties and writing indented output.
    ///
    /// @param format project file variant to write, not null
    /// @return configured mapper, never null
    public static ObjectMapper createMapper(ProjectFormat format) {
        return new ObjectMapper()
                .registerModule(new RegradaJacksonModule(format))
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
