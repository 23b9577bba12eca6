package org.postfixer.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.postfixer.runtime.interpreter.InterpretingBackend;
import org.postfixer.runtime.jit.MethodHandleBackend;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RuntimeOptionsTest {

    @Test
    @Tag("unit")
    void fromConfig_withBackendBlock_shouldReadIt() {
        // Arrange
        Config config = ConfigFactory.parseString("""
                postfixer.backend {
                  type = "METHOD_HANDLE"
                  max-stack-depth = 64
                }
                """);

        // Act
        RuntimeOptions options = RuntimeOptions.fromConfig(config);

        // Assert
        assertThat(options.backendType()).isEqualTo(BackendType.METHOD_HANDLE);
        assertThat(options.maxStackDepth()).isEqualTo(64);
        assertThat(BackendFactory.create(options)).isInstanceOf(MethodHandleBackend.class);
    }

    @Test
    @Tag("unit")
    void fromConfig_withoutBackendBlock_shouldUseDefaults() {
        RuntimeOptions options = RuntimeOptions.fromConfig(ConfigFactory.empty());

        assertThat(options).isEqualTo(RuntimeOptions.defaults());
        assertThat(options.maxStackDepth()).isEqualTo(32);
        assertThat(BackendFactory.create(options)).isInstanceOf(InterpretingBackend.class);
    }

    @Test
    @Tag("unit")
    void fromConfig_withReferenceConf_shouldMatchDefaults() {
        assertThat(RuntimeOptions.fromConfig(ConfigFactory.load())).isEqualTo(RuntimeOptions.defaults());
    }

    @Test
    @Tag("unit")
    void fromConfig_withUnknownType_shouldFail() {
        Config config = ConfigFactory.parseString("postfixer.backend.type = \"LLVM\"");

        assertThatThrownBy(() -> RuntimeOptions.fromConfig(config)).isInstanceOf(ConfigException.BadValue.class);
    }

    @Test
    @Tag("unit")
    void constructor_withNonPositiveDepth_shouldFail() {
        assertThatThrownBy(() -> new RuntimeOptions(BackendType.INTERPRETER, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
