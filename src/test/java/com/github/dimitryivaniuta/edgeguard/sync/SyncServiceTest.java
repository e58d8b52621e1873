package com.github.dimitryivaniuta.edgeguard.sync;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.edgeguard.store.InMemoryKeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SyncServiceTest {

    private static final String HASH = "abcdef0123456789abcdef";

    private final ObjectMapper mapper = new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private InMemoryKeyValueStore store;
    private SyncService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        service = new SyncService(store, mapper);
    }

    private SyncPayload payload(String json) throws Exception {
        return SyncPayload.from(mapper.readTree(json));
    }

    @Test
    void firstWriteIsStoredVerbatim() throws Exception {
        SyncOutcome outcome = service.save(HASH, payload("{\"lastModified\":100,\"state\":\"c1\",\"v\":2}"));

        assertThat(outcome.status()).isEqualTo(SyncOutcome.Status.STORED);
        assertThat(store.get("sync_data:" + HASH)).hasValueSatisfying(doc -> {
            assertThat(doc).contains("\"lastModified\":100").contains("\"state\":\"c1\"").contains("\"v\":2");
        });
    }

    @Test
    void sameTimestampIsNotModifiedAndDoesNotWrite() throws Exception {
        service.save(HASH, payload("{\"lastModified\":100,\"state\":\"c1\"}"));

        SyncOutcome outcome = service.save(HASH, payload("{\"lastModified\":100.0,\"state\":\"different\"}"));

        assertThat(outcome.status()).isEqualTo(SyncOutcome.Status.NOT_MODIFIED);
        assertThat(service.load(HASH)).hasValueSatisfying(doc -> assertThat(doc).contains("c1"));
    }

    @Test
    void olderClientGetsConflictWithServerCopy() throws Exception {
        service.save(HASH, payload("{\"lastModified\":200,\"state\":\"server\"}"));

        SyncOutcome outcome = service.save(HASH, payload("{\"lastModified\":150,\"state\":\"client\"}"));

        assertThat(outcome.status()).isEqualTo(SyncOutcome.Status.CONFLICT);
        assertThat(outcome.storedDocument()).contains("server");
        assertThat(service.load(HASH)).hasValueSatisfying(doc -> assertThat(doc).contains("server"));
    }

    @Test
    void newerClientWins() throws Exception {
        service.save(HASH, payload("{\"lastModified\":200,\"state\":\"old\"}"));

        assertThat(service.save(HASH, payload("{\"lastModified\":201,\"state\":\"new\"}")).status())
                .isEqualTo(SyncOutcome.Status.STORED);
        assertThat(service.load(HASH)).hasValueSatisfying(doc -> assertThat(doc).contains("new"));
    }

    @Test
    void corruptOrTimestamplessStoredDocumentIsOverwritten() throws Exception {
        store.set("sync_data:" + HASH, "{not json");
        assertThat(service.save(HASH, payload("{\"lastModified\":1,\"state\":\"a\"}")).status())
                .isEqualTo(SyncOutcome.Status.STORED);

        store.set("sync_data:" + HASH, "{\"state\":\"legacy\"}");
        assertThat(service.save(HASH, payload("{\"lastModified\":1,\"state\":\"b\"}")).status())
                .isEqualTo(SyncOutcome.Status.STORED);
        assertThat(service.load(HASH)).hasValueSatisfying(doc -> assertThat(doc).contains("\"b\""));
    }

    @Test
    void loadOfUnknownKeyIsEmpty() {
        assertThat(service.load("nobody-0123456789")).isEmpty();
    }
}
