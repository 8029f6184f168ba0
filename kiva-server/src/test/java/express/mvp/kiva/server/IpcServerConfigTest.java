package express.mvp.kiva.server;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.kiva.ipc.ConnectionMode;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("IpcServerConfig")
class IpcServerConfigTest {

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("Match the documented defaults")
        void documentedDefaults() {
            IpcServerConfig config = IpcServerConfig.defaults();

            assertEquals(IpcServerConfig.NO_READ_LIMIT, config.getReadLimit());
            assertFalse(config.hasReadLimit());
            assertEquals(8192, config.getChunkSize());
            assertEquals(0, config.getMaxConnections());
            assertEquals(ConnectionMode.TEXT_DATA, config.getDefaultMode());
            assertEquals(Duration.ofMillis(100), config.getCloseLinger());
            assertEquals(Duration.ofSeconds(5), config.getShutdownTimeout());
            assertEquals("kiva-session", config.getThreadNamePrefix());
        }
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Applies every setting")
        void appliesSettings() {
            IpcServerConfig config = IpcServerConfig.builder()
                    .readLimit(1024)
                    .chunkSize(512)
                    .maxConnections(8)
                    .defaultMode(ConnectionMode.PERSISTENT)
                    .closeLinger(Duration.ZERO)
                    .shutdownTimeout(Duration.ofSeconds(1))
                    .threadNamePrefix("ipc")
                    .build();

            assertEquals(1024, config.getReadLimit());
            assertTrue(config.hasReadLimit());
            assertEquals(512, config.getChunkSize());
            assertEquals(8, config.getMaxConnections());
            assertEquals(ConnectionMode.PERSISTENT, config.getDefaultMode());
            assertEquals(Duration.ZERO, config.getCloseLinger());
            assertEquals(Duration.ofSeconds(1), config.getShutdownTimeout());
            assertEquals("ipc", config.getThreadNamePrefix());
        }

        @Test
        @DisplayName("Rejects invalid values")
        void rejectsInvalid() {
            assertThrows(IllegalArgumentException.class,
                    () -> IpcServerConfig.builder().readLimit(-1).build());
            assertThrows(IllegalArgumentException.class,
                    () -> IpcServerConfig.builder().chunkSize(0).build());
            assertThrows(IllegalArgumentException.class,
                    () -> IpcServerConfig.builder().maxConnections(-1).build());
            assertThrows(IllegalArgumentException.class,
                    () -> IpcServerConfig.builder().closeLinger(Duration.ofMillis(-1)).build());
            assertThrows(IllegalArgumentException.class,
                    () -> IpcServerConfig.builder().shutdownTimeout(Duration.ofMillis(-1)).build());
            assertThrows(IllegalArgumentException.class,
                    () -> IpcServerConfig.builder().threadNamePrefix(" ").build());
        }
    }
}
