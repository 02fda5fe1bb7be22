package me.golemcore.veritas.adapter.outbound.storage;

import me.golemcore.veritas.infrastructure.config.VeritasProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TEST_DIR = "test-dir";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        VeritasProperties properties = new VeritasProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void shouldCreateKnownDirectoriesOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve("kv")));
        assertTrue(Files.isDirectory(tempDir.resolve("sessions")));
    }

    @Test
    void putAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "file.json", "{\"a\":1}").get();

        assertEquals("{\"a\":1}", storageAdapter.getText(TEST_DIR, "file.json").get());
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(TEST_DIR, "missing.json").get());
    }

    @Test
    void putTextAtomic_replacesExistingContentWithoutLeavingTempFiles()
            throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "file.json", "old").get();
        storageAdapter.putTextAtomic(TEST_DIR, "file.json", "new").get();

        assertEquals("new", storageAdapter.getText(TEST_DIR, "file.json").get());
        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve("file.json.tmp")));
    }

    @Test
    void listObjects_filtersByPrefixAndSorts() throws Exception {
        storageAdapter.putTextAtomic(TEST_DIR, "b-file", "1").get();
        storageAdapter.putTextAtomic(TEST_DIR, "a-file", "2").get();
        storageAdapter.putTextAtomic(TEST_DIR, "other", "3").get();
        Files.writeString(tempDir.resolve(TEST_DIR).resolve("a-partial.tmp"), "x");

        assertEquals(List.of("a-file", "b-file"), storageAdapter.listObjects(TEST_DIR, "").get()
                .stream().filter(name -> !name.equals("other")).toList());
        assertEquals(List.of("a-file"), storageAdapter.listObjects(TEST_DIR, "a-").get());
    }

    @Test
    void listObjects_returnsEmptyForMissingDirectory() throws ExecutionException, InterruptedException {
        assertTrue(storageAdapter.listObjects("nope", "").get().isEmpty());
    }

    @Test
    void shouldBlockPathTraversal() {
        CompletionException ex = assertThrows(CompletionException.class,
                () -> storageAdapter.getText(TEST_DIR, "../../etc/passwd").join());
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }
}
