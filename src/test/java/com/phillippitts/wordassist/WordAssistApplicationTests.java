package com.phillippitts.wordassist;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class WordAssistApplicationTests {

    @TempDir
    static Path configDir;

    @DynamicPropertySource
    static void configStore(DynamicPropertyRegistry registry) {
        registry.add("wordassist.config.path", () -> configDir.resolve("config.json").toString());
        registry.add("wordassist.config.watch-enabled", () -> "false");
    }

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void contextLoadsAndCreatesDefaultConfig() {
        ResponseEntity<Map> response = restTemplate.getForEntity("/api/providers", Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).containsEntry("activeProvider", "google");
        assertThat((List<?>) response.getBody().get("providers")).hasSize(8);
        assertThat(response.getBody().toString()).doesNotContain("apiKey");
        assertThat(Files.exists(configDir.resolve("config.json"))).isTrue();
    }

    @Test
    void parseWithoutConfiguredKeysIsServiceUnavailable() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<Map> response = restTemplate.postForEntity(
                "/api/parse", new HttpEntity<>("{\"text\":\"serendipity\"}", headers), Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).containsEntry("error", "NoProvidersAvailableException");
    }

    @Test
    void blankTextIsBadRequest() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<Map> response = restTemplate.postForEntity(
                "/api/parse", new HttpEntity<>("{\"text\":\"  \"}", headers), Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void healthReportsProviderComponent() {
        ResponseEntity<String> response = restTemplate.getForEntity("/actuator/health", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).contains("\"provider\"").contains("No provider checked yet");
    }
}
