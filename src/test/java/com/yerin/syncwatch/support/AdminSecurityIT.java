package com.yerin.syncwatch.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ActiveProfiles("test")
@DisplayName("관리자 경로 보호 + 스케줄러 제어 스모크")
class AdminSecurityIT extends IntegrationTestBase {

    @Autowired
    TestRestTemplate rest;

    @Test
    @DisplayName("헤더 없음 또는 잘못된 토큰 → 401")
    void blocks_without_valid_token() {
        HttpHeaders wrong = new HttpHeaders();
        wrong.set("X-Admin-Token", "wrong-token");

        ResponseEntity<String> r1 = rest.getForEntity("/admin/metrics/jobs", String.class);
        ResponseEntity<String> r2 = rest.exchange("/admin/metrics/connections", HttpMethod.GET, new HttpEntity<>(wrong), String.class);

        assertThat(r1.getStatusCode().value()).isEqualTo(401);
        assertThat(r2.getStatusCode().value()).isEqualTo(401);
    }

    @Test
    @DisplayName("정상 토큰 → 메트릭과 연결 수 조회")
    void metrics_with_valid_token() {
        HttpEntity<Void> auth = new HttpEntity<>(adminHeaders());

        ResponseEntity<String> jobs = rest.exchange("/admin/metrics/jobs", HttpMethod.GET, auth, String.class);
        ResponseEntity<String> conns = rest.exchange("/admin/metrics/connections", HttpMethod.GET, auth, String.class);

        assertThat(jobs.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(jobs.getBody()).contains("successRate").contains("queueDepth");
        assertThat(conns.getBody()).contains("connections");
    }

    @Test
    @DisplayName("스케줄러 시작/중지는 관리자만, 상태 조회는 누구나")
    void scheduler_start_stop() {
        HttpEntity<Void> auth = new HttpEntity<>(adminHeaders());

        ResponseEntity<Map> started = rest.exchange("/admin/scheduler/start", HttpMethod.POST, auth, Map.class);
        ResponseEntity<Map> status = rest.getForEntity("/scheduler/status", Map.class);
        ResponseEntity<Map> stopped = rest.exchange("/admin/scheduler/stop", HttpMethod.POST, auth, Map.class);

        assertThat(((Map<?, ?>) started.getBody().get("data")).get("running")).isEqualTo(true);
        assertThat(((Map<?, ?>) status.getBody().get("data")).get("running")).isEqualTo(true);
        assertThat(((Map<?, ?>) stopped.getBody().get("data")).get("running")).isEqualTo(false);
    }

    @Test
    @DisplayName("모르는 설정 키는 400 과 SYNC-002")
    void rejects_unknown_config_key() {
        HttpEntity<Map<String, Object>> req = new HttpEntity<>(Map.of("bogus_interval", 10), adminHeaders());

        ResponseEntity<Map> r = rest.exchange("/admin/scheduler/config", HttpMethod.PUT, req, Map.class);

        assertThat(r.getStatusCode().value()).isEqualTo(400);
        assertThat(r.getBody().get("code")).isEqualTo("SYNC-002");
        assertThat(String.valueOf(r.getBody().get("message"))).contains("bogus_interval");
    }

    private static HttpHeaders adminHeaders() {
        HttpHeaders h = new HttpHeaders();
        h.set("X-Admin-Token", "test-admin-token"); // application-test.yml
        return h;
    }
}
