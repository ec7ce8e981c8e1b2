package com.ministation.auth.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class PrincipalInterceptorTest {

    private final PrincipalInterceptor interceptor = new PrincipalInterceptor(new ObjectMapper());

    @AfterEach
    void clear() {
        PrincipalContext.clear();
    }

    @Test
    void preHandle_ShouldExposeTrimmedPrincipal() {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/station/create");
        req.addHeader(PrincipalInterceptor.HEADER, "  alice ");

        assertThat(interceptor.preHandle(req, new MockHttpServletResponse(), new Object())).isTrue();
        assertThat(PrincipalContext.getPrincipal()).isEqualTo("alice");
    }

    @Test
    void preHandle_ShouldRejectAnonymousWrites() throws Exception {
        MockHttpServletResponse resp = new MockHttpServletResponse();

        boolean proceed = interceptor.preHandle(new MockHttpServletRequest("POST", "/station/member/join"), resp, new Object());

        assertThat(proceed).isFalse();
        assertThat(resp.getStatus()).isEqualTo(401);
        assertThat(resp.getContentAsString()).contains("\"unauthorized\"");
    }

    @Test
    void preHandle_ShouldAllowAnonymousReads() {
        assertThat(interceptor.preHandle(new MockHttpServletRequest("GET", "/station/list"),
                new MockHttpServletResponse(), new Object())).isTrue();
        assertThat(PrincipalContext.getPrincipal()).isNull();
    }

    @Test
    void normalize_ShouldRejectBlankAndOverlong() {
        assertThat(PrincipalInterceptor.normalize(" ")).isNull();
        assertThat(PrincipalInterceptor.normalize(null)).isNull();
        assertThat(PrincipalInterceptor.normalize("x".repeat(65))).isNull();
        assertThat(PrincipalInterceptor.normalize("bob")).isEqualTo("bob");
    }

    @Test
    void afterCompletion_ShouldClearContext() {
        PrincipalContext.setPrincipal("carol");
        interceptor.afterCompletion(new MockHttpServletRequest(), new MockHttpServletResponse(), new Object(), null);
        assertThat(PrincipalContext.getPrincipal()).isNull();
    }
}
