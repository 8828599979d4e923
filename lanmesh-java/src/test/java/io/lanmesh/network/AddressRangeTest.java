package io.lanmesh.network;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AddressRange")
class AddressRangeTest {

    @Test
    @DisplayName("should enumerate a contiguous range")
    void shouldEnumerate() {
        AddressRange range = new AddressRange("10.102.251.", 1, 3);

        assertEquals(List.of("10.102.251.1", "10.102.251.2", "10.102.251.3"), range.addresses());
    }

    @Test
    @DisplayName("should test membership by suffix")
    void shouldTestMembership() {
        AddressRange range = new AddressRange("10.102.251.", 5, 10);

        assertTrue(range.contains("10.102.251.5"));
        assertTrue(range.contains("10.102.251.14"));
        assertFalse(range.contains("10.102.251.15"));
        assertFalse(range.contains("10.102.251.4"));
        assertFalse(range.contains("10.102.252.6"));
        assertFalse(range.contains("10.102.251.x"));
        assertFalse(range.contains(null));
    }

    @Test
    @DisplayName("should allow an empty range and reject invalid ones")
    void shouldValidate() {
        assertTrue(new AddressRange("10.0.0.", 1, 0).addresses().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new AddressRange("", 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new AddressRange("10.0.0.", -1, 1));
    }

    @Test
    @DisplayName("should treat a specific bind host as the only own address")
    void shouldUseSpecificBindHost() {
        assertEquals(Set.of("127.0.0.2"), AddressRange.ownAddresses("127.0.0.2"));
        assertEquals(Set.of("127.0.0.1"), AddressRange.ownAddresses("localhost"));
    }

    @Test
    @DisplayName("should include loopback for a wildcard bind")
    void shouldIncludeLoopbackForWildcard() {
        assertTrue(AddressRange.ownAddresses("0.0.0.0").contains("127.0.0.1"));
        assertTrue(AddressRange.isWildcard("0.0.0.0"));
        assertTrue(AddressRange.isWildcard(""));
        assertFalse(AddressRange.isWildcard("10.0.0.1"));
    }
}
