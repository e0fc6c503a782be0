package me.golemcore.archivist.infrastructure.http;

import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OkHttpConfigTest {

    @Test
    void shouldApplyConfiguredTimeouts() {
        ArchivistProperties properties = new ArchivistProperties();
        properties.getHttp().setConnectTimeout(1500);
        properties.getHttp().setReadTimeout(2500);
        properties.getHttp().setWriteTimeout(3500);

        OkHttpClient client = new OkHttpConfig(properties).okHttpClient();

        assertEquals(1500, client.connectTimeoutMillis());
        assertEquals(2500, client.readTimeoutMillis());
        assertEquals(3500, client.writeTimeoutMillis());
        assertTrue(client.retryOnConnectionFailure());
    }
}
