package io.lanmesh.network;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MeshOptions")
class MeshOptionsTest {

    @Test
    @DisplayName("should carry documented defaults")
    void shouldHaveDefaults() {
        MeshOptions options = MeshOptions.defaults();

        assertEquals("0.0.0.0", options.bindHost);
        assertEquals(9090, options.port);
        assertEquals("10.102.251.", options.addressPrefix);
        assertEquals(1, options.addressStart);
        assertEquals(20, options.addressCount);
        assertEquals(Duration.ofSeconds(2), options.initiatorStepTimeout);
        assertEquals(Duration.ofSeconds(5), options.acceptorStepTimeout);
        assertEquals(10, options.maxSeekAttempts);
        assertEquals(Duration.ofSeconds(1), options.seekBackoff);
        assertEquals(64 * 1024, options.maxFrameLength);
        assertTrue(options.yieldToLowerId);
        assertFalse(options.hasSpecificBindHost());
    }

    @Test
    @DisplayName("should load the bundled resource")
    void shouldLoadResource() {
        MeshOptions loaded = MeshOptions.load();

        assertEquals(MeshOptions.defaults().port, loaded.port);
        assertEquals(MeshOptions.defaults().addressPrefix, loaded.addressPrefix);
    }

    @Nested
    @DisplayName("Properties")
    class PropertiesTests {

        @Test
        @DisplayName("should read prefixed keys")
        void shouldReadKeys() {
            Properties props = new Properties();
            props.setProperty("lanmesh.bindHost", "192.168.1.7");
            props.setProperty("lanmesh.port", "7000");
            props.setProperty("lanmesh.addressPrefix", "192.168.1.");
            props.setProperty("lanmesh.addressCount", "5");
            props.setProperty("lanmesh.initiatorStepTimeoutMs", "750");
            props.setProperty("lanmesh.seekBackoffMs", "0");
            props.setProperty("lanmesh.yieldToLowerId", "false");
            props.setProperty("unrelated.port", "1");

            MeshOptions options = MeshOptions.fromProperties(props);

            assertEquals("192.168.1.7", options.bindHost);
            assertTrue(options.hasSpecificBindHost());
            assertEquals(7000, options.port);
            assertEquals(new AddressRange("192.168.1.", 1, 5), options.addressRange());
            assertEquals(Duration.ofMillis(750), options.initiatorStepTimeout);
            assertEquals(Duration.ZERO, options.seekBackoff);
            assertFalse(options.yieldToLowerId);
            assertEquals(Duration.ofSeconds(5), options.acceptorStepTimeout);
        }

        @Test
        @DisplayName("should name the key of an unparseable value")
        void shouldNameBadKey() {
            Properties props = new Properties();
            props.setProperty("lanmesh.maxSeekAttempts", "lots");

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> MeshOptions.fromProperties(props));
            assertTrue(e.getMessage().contains("lanmesh.maxSeekAttempts"));
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("should reject invalid values")
        void shouldRejectInvalid() {
            assertThrows(IllegalArgumentException.class, () -> MeshOptions.builder().port(70000).build());
            assertThrows(IllegalArgumentException.class, () -> MeshOptions.builder().maxSeekAttempts(0).build());
            assertThrows(IllegalArgumentException.class,
                () -> MeshOptions.builder().initiatorStepTimeout(Duration.ZERO).build());
            assertThrows(IllegalArgumentException.class,
                () -> MeshOptions.builder().seekBackoff(Duration.ofMillis(-1)).build());
            assertThrows(IllegalArgumentException.class, () -> MeshOptions.builder().maxFrameLength(10).build());
        }

        @Test
        @DisplayName("should copy through toBuilder")
        void shouldCopy() {
            MeshOptions original = MeshOptions.builder().port(1234).maxSeekAttempts(3).build();
            MeshOptions copy = original.toBuilder().bindHost("127.0.0.1").build();

            assertEquals(1234, copy.port);
            assertEquals(3, copy.maxSeekAttempts);
            assertEquals("127.0.0.1", copy.bindHost);
        }
    }
}
