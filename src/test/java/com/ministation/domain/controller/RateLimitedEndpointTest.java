package com.ministation.domain.controller;

import com.ministation.auth.web.PrincipalInterceptor;
import com.ministation.common.api.ApiCodes;
import com.ministation.common.ratelimit.FixedWindowLimiter;
import com.ministation.support.StationIntegrationSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
@TestPropertySource(properties = "station.ratelimit.enabled=true")
class RateLimitedEndpointTest extends StationIntegrationSupport {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FixedWindowLimiter limiter;

    @Test
    void createStation_ShouldPassThroughLimiter_WhenUnderLimit() throws Exception {
        when(limiter.hit(anyString(), anyLong(), anyLong())).thenReturn(0L);

        mockMvc.perform(post("/station/create")
                        .header(PrincipalInterceptor.HEADER, "Alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Mars Base\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.slug").value("mars-base"));

        verify(limiter).hit("station:rl:station_create:PRINCIPAL:alice", 60, 3);
    }

    @Test
    void createStation_ShouldReturn429WithRetryAfter_WhenLimited() throws Exception {
        when(limiter.hit(anyString(), anyLong(), anyLong())).thenReturn(30L);

        mockMvc.perform(post("/station/create")
                        .header(PrincipalInterceptor.HEADER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Mars Base\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string(HttpHeaders.RETRY_AFTER, "30"))
                .andExpect(jsonPath("$.code").value(ApiCodes.TOO_MANY_REQUESTS));

        assertThat(stationService.listActive(null)).isEmpty();
    }

    @Test
    void createPost_ShouldBeLimitedThroughProxy() throws Exception {
        long id = createStation("alice", "Mars Base");
        when(limiter.hit(anyString(), anyLong(), anyLong())).thenReturn(12L);

        mockMvc.perform(post("/station/post/create")
                        .header(PrincipalInterceptor.HEADER, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stationId\":\"" + id + "\",\"type\":\"update\",\"title\":\"t\",\"content\":\"c\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string(HttpHeaders.RETRY_AFTER, "12"));
    }
}
