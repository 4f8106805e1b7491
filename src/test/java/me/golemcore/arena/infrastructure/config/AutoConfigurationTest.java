package me.golemcore.arena.infrastructure.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AutoConfigurationTest {

    @Test
    void shouldWriteDatesAsIsoStringsAndIgnoreUnknownFields() throws JsonProcessingException {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        assertEquals("\"2025-01-02T18:00:00\"", mapper.writeValueAsString(LocalDateTime.of(2025, 1, 2, 18, 0)));
        assertEquals(LocalDateTime.of(2025, 1, 2, 18, 0),
                mapper.readValue("{\"at\":\"2025-01-02T18:00:00\",\"extra\":1}", Holder.class).at);
    }

    @Test
    void shouldRunResolverTasksOnDaemonThreads() throws Exception {
        ArenaProperties properties = new ArenaProperties();
        properties.getBatch().setWorkers(2);
        ExecutorService executor = new AutoConfiguration(properties).resolverExecutor();
        try {
            Future<Boolean> daemon = executor.submit(() -> Thread.currentThread().isDaemon());
            Future<String> name = executor.submit(() -> Thread.currentThread().getName());

            assertTrue(daemon.get());
            assertTrue(name.get().startsWith("arena-resolver-"));
        } finally {
            executor.shutdownNow();
        }
    }

    static class Holder {
        public LocalDateTime at;
    }
}
