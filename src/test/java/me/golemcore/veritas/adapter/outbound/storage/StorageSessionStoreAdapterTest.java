package me.golemcore.veritas.adapter.outbound.storage;

import me.golemcore.veritas.domain.model.ChatMessage;
import me.golemcore.veritas.domain.model.SessionRecord;
import me.golemcore.veritas.domain.model.StoreException;
import me.golemcore.veritas.domain.service.SessionHistoryService;
import me.golemcore.veritas.infrastructure.config.AutoConfiguration;
import me.golemcore.veritas.infrastructure.config.VeritasProperties;
import me.golemcore.veritas.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StorageSessionStoreAdapterTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private StorageSessionStoreAdapter store;

    @BeforeEach
    void setUp() {
        VeritasProperties properties = new VeritasProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        store = new StorageSessionStoreAdapter(storage, AutoConfiguration.objectMapper());
    }

    @Test
    void shouldReturnEmptyForUnknownSession() {
        assertTrue(store.get("unknown").isEmpty());
    }

    @Test
    void shouldPersistSessionAsJsonFile() throws Exception {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.builder().id("1").content("hi").user("user").role(ChatMessage.ROLE_USER).build());
        store.put(SessionRecord.builder().sessionId("abc").messages(messages).created(CREATED).build());

        Optional<SessionRecord> loaded = store.get("abc");

        assertTrue(loaded.isPresent());
        assertEquals(CREATED, loaded.get().getCreated());
        assertEquals("hi", loaded.get().getMessages().get(0).getContent());
        String json = Files.readString(tempDir.resolve("sessions").resolve("abc.json"));
        assertTrue(json.contains("\"created\":\"2026-03-01T10:00:00Z\""));
    }

    @Test
    void shouldFailOnUnreadableSessionFile() throws Exception {
        Files.writeString(tempDir.resolve("sessions").resolve("broken.json"), "{oops");

        assertThrows(StoreException.class, () -> store.get("broken"));
    }

    @Test
    void shouldNotOverwriteCorruptTranscriptOnAppend() throws Exception {
        Path file = tempDir.resolve("sessions").resolve("s1.json");
        String truncated = "{\"sessionId\":\"s1\",\"messages\":[{\"id\":\"1\",\"content\":\"precious history\"";
        Files.writeString(file, truncated);
        SessionHistoryService history = new SessionHistoryService(store, AutoConfiguration.objectMapper(),
                Clock.fixed(CREATED, ZoneOffset.UTC));

        assertThrows(StoreException.class, () -> history.appendExchange("s1", "q", "a", "user"));
        assertEquals(truncated, Files.readString(file));
    }

    @Test
    void shouldWrapReadFailures() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.getText(anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("io")));
        StorageSessionStoreAdapter failingStore = new StorageSessionStoreAdapter(failing,
                AutoConfiguration.objectMapper());

        assertThrows(StoreException.class, () -> failingStore.get("abc"));
    }
}
