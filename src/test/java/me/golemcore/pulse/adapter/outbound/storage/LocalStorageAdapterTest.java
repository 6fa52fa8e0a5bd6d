package me.golemcore.pulse.adapter.outbound.storage;

import me.golemcore.pulse.infrastructure.config.PulseProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    @TempDir
    Path tempDir;

    private LocalStorageAdapter adapter;

    @BeforeEach
    void setUp() {
        PulseProperties properties = new PulseProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        adapter = new LocalStorageAdapter(properties);
        adapter.init();
    }

    @Test
    void shouldCreateStorageDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve("jobs")));
        assertTrue(Files.isDirectory(tempDir.resolve("notifications")));
        assertTrue(Files.isDirectory(tempDir.resolve("reminders")));
    }

    @Test
    void shouldReturnNullForMissingFile() {
        assertNull(adapter.getText("jobs", "jobs.json").join());
    }

    @Test
    void shouldWriteAtomicallyAndKeepBackup() throws Exception {
        adapter.putTextAtomic("jobs", "jobs.json", "[1]", true).join();
        adapter.putTextAtomic("jobs", "jobs.json", "[1,2]", true).join();

        assertEquals("[1,2]", adapter.getText("jobs", "jobs.json").join());
        assertEquals("[1]", Files.readString(tempDir.resolve("jobs/jobs.json.bak"), StandardCharsets.UTF_8));
        assertFalse(Files.exists(tempDir.resolve("jobs/jobs.json.tmp")));
    }

    @Test
    void shouldSkipBackupWhenDisabled() {
        adapter.putTextAtomic("notifications", "ledger.json", "[]", false).join();
        adapter.putTextAtomic("notifications", "ledger.json", "[{}]", false).join();

        assertFalse(Files.exists(tempDir.resolve("notifications/ledger.json.bak")));
    }

    @Test
    void shouldBlockPathTraversal() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> adapter.putTextAtomic("jobs", "../../escape.json", "x", false).join());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }
}
