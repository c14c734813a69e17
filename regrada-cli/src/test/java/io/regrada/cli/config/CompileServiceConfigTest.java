package io.regrada.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.util.Optional;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("CompileServiceConfig")
class CompileServiceConfigTest {

    @Nested
    @DisplayName("builder")
    class BuilderTests {

        @Test
        @DisplayName("uses the documented defaults")
        void shouldApplyDefaults() {
            // When
            var config = CompileServiceConfig.builder().build();

            // Then
            assertThat(config.getUrl()).isEqualTo("http://localhost:8080");
            assertThat(config.getPollAttempts()).isEqualTo(10);
            assertThat(config.getPollIntervalMs()).isEqualTo(500);
            assertThat(config.getTimeoutMs()).isEqualTo(10_000);
        }

        @Test
        @DisplayName("strips trailing slashes from the URL")
        void shouldStripTrailingSlash() {
            var config = CompileServiceConfig.builder().url(" http://compile.test// ").build();

            assertThat(config.getUrl()).isEqualTo("http://compile.test");
        }

        @Test
        @DisplayName("rejects out-of-range values")
        void shouldValidate() {
            assertThatThrownBy(() -> CompileServiceConfig.builder().url(" ").build())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("URL");
            assertThatThrownBy(() -> CompileServiceConfig.builder().pollAttempts(0).build())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Poll attempts");
            assertThatThrownBy(() -> CompileServiceConfig.builder().pollIntervalMs(-1).build())
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> CompileServiceConfig.builder().timeoutMs(0).build())
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("copies every value through toBuilder")
        void shouldCopyThroughToBuilder() {
            var original = CompileServiceConfig.builder()
                    .url("http://a")
                    .pollAttempts(2)
                    .pollIntervalMs(5)
                    .timeoutMs(7)
                    .build();

            var copy = original.toBuilder().build();

            assertThat(copy.toString()).isEqualTo(original.toString());
        }
    }

    @Nested
    @DisplayName("from(Config)")
    @ExtendWith(MockitoExtension.class)
    class FromConfig {

        @Mock private Config config;

        @Test
        @DisplayName("reads the regrada.compile properties")
        void shouldReadProperties() {
            // Given
            when(config.getOptionalValue(CompileServiceConfig.URL, String.class))
                    .thenReturn(Optional.of("http://compile.test/"));
            when(config.getOptionalValue(CompileServiceConfig.POLL_ATTEMPTS, Integer.class))
                    .thenReturn(Optional.of(4));
            when(config.getOptionalValue(CompileServiceConfig.POLL_INTERVAL_MS, Long.class))
                    .thenReturn(Optional.of(25L));
            when(config.getOptionalValue(CompileServiceConfig.TIMEOUT_MS, Long.class))
                    .thenReturn(Optional.of(2_000L));

            // When
            var result = CompileServiceConfig.from(config);

            // Then
            assertThat(result.getUrl()).isEqualTo("http://compile.test");
            assertThat(result.getPollAttempts()).isEqualTo(4);
            assertThat(result.getPollIntervalMs()).isEqualTo(25);
            assertThat(result.getTimeoutMs()).isEqualTo(2_000);
        }

        @Test
        @DisplayName("keeps defaults for missing properties")
        void shouldKeepDefaults() {
            // Given
            when(config.getOptionalValue(CompileServiceConfig.URL, String.class)).thenReturn(Optional.empty());
            when(config.getOptionalValue(CompileServiceConfig.POLL_ATTEMPTS, Integer.class))
                    .thenReturn(Optional.empty());
            when(config.getOptionalValue(CompileServiceConfig.POLL_INTERVAL_MS, Long.class))
                    .thenReturn(Optional.empty());
            when(config.getOptionalValue(CompileServiceConfig.TIMEOUT_MS, Long.class))
                    .thenReturn(Optional.empty());

            // When
            var result = CompileServiceConfig.from(config);

            // Then
            assertThat(result.getUrl()).isEqualTo("http://localhost:8080");
            assertThat(result.getPollAttempts()).isEqualTo(10);
        }
    }
}
