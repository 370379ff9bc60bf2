package com.yerin.syncwatch.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.*;

@DisplayName("관리자 토큰 인터셉터 테스트")
class AdminTokenInterceptorTest {

    @Test
    @DisplayName("토큰 헤더가 없으면 401로 차단")
    void blocks_when_header_missing() {
        var inter = new AdminTokenInterceptor("secret");
        var req = new MockHttpServletRequest("POST", "/admin/scheduler/start");
        var res = new MockHttpServletResponse();

        boolean pass = inter.preHandle(req, res, new Object());

        assertThat(pass).isFalse();
        assertThat(res.getStatus()).isEqualTo(401);
    }

    @Test
    @DisplayName("토큰이 다르면 401로 차단")
    void blocks_when_header_wrong() {
        var inter = new AdminTokenInterceptor("secret");
        var req = new MockHttpServletRequest("GET", "/admin/metrics/jobs");
        req.addHeader("X-Admin-Token", "nope");
        var res = new MockHttpServletResponse();

        assertThat(inter.preHandle(req, res, new Object())).isFalse();
        assertThat(res.getStatus()).isEqualTo(401);
    }

    @Test
    @DisplayName("헤더가 토큰과 일치하면 통과 (헤더 이름은 대소문자 무관)")
    void passes_when_header_matches() {
        var inter = new AdminTokenInterceptor("secret");
        var req = new MockHttpServletRequest("GET", "/admin/metrics/jobs");
        req.addHeader("X-ADMIN-TOKEN", "secret");
        var res = new MockHttpServletResponse();

        boolean pass = inter.preHandle(req, res, new Object());

        assertThat(pass).isTrue();
        assertThat(res.getStatus()).isEqualTo(200);
    }

    @Test
    @DisplayName("토큰이 설정되지 않았으면 빈 헤더로도 통과할 수 없다")
    void closed_when_token_not_configured() {
        var inter = new AdminTokenInterceptor("");
        var req = new MockHttpServletRequest("GET", "/admin/metrics/jobs");
        req.addHeader("X-Admin-Token", "");
        var res = new MockHttpServletResponse();

        assertThat(inter.preHandle(req, res, new Object())).isFalse();
        assertThat(res.getStatus()).isEqualTo(401);
    }
}
