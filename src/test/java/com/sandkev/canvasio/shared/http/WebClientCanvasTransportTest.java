package com.sandkev.canvasio.shared.http;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.sandkev.canvasio.scheduler.PendingCall;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Verifies the wire format: bearer auth, query strings for GET, JSON bodies for writes,
 * and that error statuses come back as responses instead of exceptions.
 */
class WebClientCanvasTransportTest {

    private WireMockServer wm;
    private WebClientCanvasTransport transport;

    @BeforeEach
    void setUp() {
        wm = new WireMockServer(0);
        wm.start();

        WebClient webClient = WebClient.builder()
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .build();
        transport = new WebClientCanvasTransport(webClient, "http://localhost:" + wm.port());
    }

    @AfterEach
    void tearDown() {
        if (wm.isRunning()) wm.stop();
    }

    @Test
    void getSendsQueryAndBearerAndReturnsQuotaAndLink() {
        wm.stubFor(get(urlPathEqualTo("/api/v1/courses/1/modules"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withHeader("X-Rate-Limit-Remaining", "699.5")
                        .withHeader("Link", "<http://localhost/api/v1/courses/1/modules?page=2>; rel=\"next\"")
                        .withBody("[{\"id\":1}]")));

        ApiResponse resp = transport.exchange(PendingCall.get("/api/v1/courses/1/modules",
                Map.of("per_page", 100, "include", List.of("items", "content_details")))).block(Duration.ofSeconds(5));

        assertThat(resp.status()).isEqualTo(200);
        assertThat(resp.body()).isEqualTo("[{\"id\":1}]");
        assertThat(resp.rateLimitRemaining()).isEqualTo(699.5);
        assertThat(resp.linkHeader()).contains("rel=\"next\"");

        var req = wm.getAllServeEvents().get(0).getRequest();
        assertThat(req.getHeader("Authorization")).isEqualTo("Bearer test-token");
        assertThat(req.queryParameter("per_page").firstValue()).isEqualTo("100");
        assertThat(req.queryParameter("include").values()).containsExactly("items", "content_details");
    }

    @Test
    void putSendsJsonBody() {
        wm.stubFor(put(urlEqualTo("/api/v1/courses/1/assignments/2"))
                .willReturn(okJson("{\"id\":2,\"name\":\"Lab\"}")));

        transport.exchange(PendingCall.put("/api/v1/courses/1/assignments/2",
                Map.of("assignment", Map.of("name", "Lab")))).block(Duration.ofSeconds(5));

        wm.verify(putRequestedFor(urlEqualTo("/api/v1/courses/1/assignments/2"))
                .withHeader("Content-Type", containing("application/json"))
                .withRequestBody(equalToJson("{\"assignment\":{\"name\":\"Lab\"}}")));
    }

    @Test
    void absoluteUrlIsUsedAsIs() {
        wm.stubFor(get(urlPathEqualTo("/api/v1/courses")).willReturn(okJson("[]")));

        transport.exchange(PendingCall.get("http://localhost:" + wm.port() + "/api/v1/courses",
                Map.of("page", "bookmark:WzJd"))).block(Duration.ofSeconds(5));

        var req = wm.getAllServeEvents().get(0).getRequest();
        assertThat(req.queryParameter("page").firstValue()).isEqualTo("bookmark:WzJd");
        assertThat(req.getHeader("Authorization")).isEqualTo("Bearer test-token");
    }

    @Test
    void reservedCharactersInQueryValuesAreEscaped() {
        wm.stubFor(get(urlPathEqualTo("/api/v1/courses")).willReturn(okJson("[]")));

        transport.exchange(PendingCall.get("/api/v1/courses",
                Map.of("search_term", "a+b&c=d"))).block(Duration.ofSeconds(5));
        transport.exchange(PendingCall.get("http://localhost:" + wm.port() + "/api/v1/courses",
                Map.of("page", "bookmark:Wz+Jd/x="))).block(Duration.ofSeconds(5));

        var relative = wm.getAllServeEvents().get(1).getRequest();
        var absolute = wm.getAllServeEvents().get(0).getRequest();
        assertThat(relative.getUrl()).isEqualTo("/api/v1/courses?search_term=a%2Bb%26c%3Dd");
        assertThat(relative.queryParameter("search_term").firstValue()).isEqualTo("a+b&c=d");
        assertThat(absolute.queryParameter("page").firstValue()).isEqualTo("bookmark:Wz+Jd/x=");
    }

    @Test
    void errorStatusIsReturnedNotThrown() {
        wm.stubFor(delete(urlEqualTo("/api/v1/courses/1/pages/home"))
                .willReturn(aResponse().withStatus(403).withBody("403 Forbidden (Rate Limit Exceeded)")));

        ApiResponse resp = transport.exchange(PendingCall.delete("/api/v1/courses/1/pages/home")).block(Duration.ofSeconds(5));

        assertThat(resp.status()).isEqualTo(403);
        assertThat(HttpRetrySupport.isQuotaRejection(resp.status(), resp.body())).isTrue();
        assertThat(resp.rateLimitRemaining()).isNull();
    }

    @Test
    void connectionFailureBecomesTransportException() {
        int port = wm.port();
        wm.stop();
        var dead = new WebClientCanvasTransport(WebClient.builder().build(), "http://localhost:" + port);

        assertThatThrownBy(() -> dead.exchange(PendingCall.get("/api/v1/courses")).block(Duration.ofSeconds(5)))
                .isInstanceOf(CanvasTransportException.class);
    }
}
