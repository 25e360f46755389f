package io.newsdigest.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                "spring.datasource.url=jdbc:h2:mem:pipeline;DB_CLOSE_DELAY=-1",
                "rss.processing.enable-scheduling=false",
                "rss.processing.initial-delay=1h",
                "vector-store.snapshot-path=",
                "vector-store.rebuild-missing-on-startup=false"
        }
)
class NewsPipelineApplicationTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    @DisplayName("Should report UP with an empty store")
    void shouldReportStatus() {
        ResponseEntity<String> response = restTemplate.getForEntity("/api/v1/status", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).contains("\"status\":\"UP\"");
        assertThat(response.getBody()).contains("news-pipeline");
    }

    @Test
    @DisplayName("Should seed the catalog from configured sources")
    void shouldListSeededFeeds() {
        ResponseEntity<String> response = restTemplate.getForEntity("/api/v1/feeds", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).contains("BBC World", "https://feeds.bbci.co.uk/news/world/rss.xml");
    }

    @Test
    @DisplayName("Should answer 404 with an error envelope for unknown articles")
    void shouldReturnNotFoundForUnknownArticle() {
        ResponseEntity<Map> response = restTemplate.getForEntity("/api/v1/articles/987654", Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).containsKey("error");
    }
}
