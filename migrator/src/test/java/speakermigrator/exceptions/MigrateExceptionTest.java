package speakermigrator.exceptions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MigrateException")
class MigrateExceptionTest {

    @Nested
    @DisplayName("constructor with message only")
    class ConstructorWithMessageOnly {

        @Test
        @DisplayName("should store message")
        void shouldStoreMessage() {
            MigrateException ex = new MigrateException("Migration failed");

            assertThat(ex.getMessage()).isEqualTo("Migration failed");
        }

        @Test
        @DisplayName("should have empty diagnostic context")
        void shouldHaveEmptyContext() {
            MigrateException ex = new MigrateException("Error");

            assertThat(ex.getDeviceAddress()).isNull();
            assertThat(ex.getStage()).isNull();
            assertThat(ex.getLog()).isEmpty();
            assertThat(ex.getCause()).isNull();
        }
    }

    @Nested
    @DisplayName("constructor with full context")
    class ConstructorWithFullContext {

        @Test
        @DisplayName("should include stage and device in the message")
        void shouldIncludeContextInMessage() {
            MigrateException ex = new MigrateException("upload failed", "10.0.0.5", "upload", "rw: ok\n", null);

            assertThat(ex.getMessage()).isEqualTo("upload failed [stage=upload] [device=10.0.0.5]");
            assertThat(ex.getLog()).isEqualTo("rw: ok\n");
        }

        @Test
        @DisplayName("should keep the cause")
        void shouldKeepCause() {
            RuntimeException cause = new RuntimeException("Root cause");

            MigrateException ex = new MigrateException("Error", "10.0.0.5", "trust", null, cause);

            assertThat(ex.getCause()).isSameAs(cause);
        }
    }

    @Nested
    @DisplayName("withContext")
    class WithContext {

        @Test
        @DisplayName("should fill missing device and log")
        void shouldFillMissingContext() {
            MigrateException ex = new MigrateException("failed to marshal", null, "encode", null, null);

            MigrateException copy = ex.withContext("10.0.0.5", "partial\n");

            assertThat(copy.getDeviceAddress()).isEqualTo("10.0.0.5");
            assertThat(copy.getLog()).isEqualTo("partial\n");
            assertThat(copy.getStage()).isEqualTo("encode");
        }

        @Test
        @DisplayName("should keep context already present")
        void shouldKeepExistingContext() {
            MigrateException ex = new MigrateException("failed", "10.0.0.5", "hosts", "original\n", null);

            MigrateException copy = ex.withContext("10.0.0.6", "other\n");

            assertThat(copy.getDeviceAddress()).isEqualTo("10.0.0.5");
            assertThat(copy.getLog()).isEqualTo("original\n");
        }
    }
}
