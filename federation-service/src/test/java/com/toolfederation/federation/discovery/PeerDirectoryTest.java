package com.toolfederation.federation.discovery;

import com.toolfederation.common.model.PeerInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.toolfederation.federation.TestServers.properties;
import static org.junit.jupiter.api.Assertions.*;

class PeerDirectoryTest {

    private final PeerDirectory directory = new PeerDirectory(properties(List.of(), false, 2, 300_000, 60_000));

    @Test
    @DisplayName("full directory drops the peer with the oldest lastContact")
    void evictsOldest() {
        directory.add(new PeerInfo("a", "http://a", 1, 50));
        directory.add(new PeerInfo("b", "http://b", 5, 50));
        directory.add(new PeerInfo("c", "http://c", 10, 50));

        assertEquals(2, directory.size());
        assertNull(directory.get("a"));
        assertNotNull(directory.get("c"));
    }

    @Test
    @DisplayName("updating a known peer never evicts another")
    void updateInPlace() {
        directory.add(new PeerInfo("a", "http://a", 1, 50));
        directory.add(new PeerInfo("b", "http://b", 5, 50));
        directory.add(new PeerInfo("a", "http://a2", 20, 60));

        assertEquals(2, directory.size());
        assertEquals("http://a2", directory.get("a").endpoint());
    }

    @Test
    @DisplayName("touch refreshes lastContact of known peers only")
    void touch() {
        directory.add(new PeerInfo("a", "http://a", 1, 50));
        directory.touch("a", 99);
        directory.touch("ghost", 99);

        assertEquals(99, directory.get("a").lastContact());
        assertNull(directory.get("ghost"));
    }
}
