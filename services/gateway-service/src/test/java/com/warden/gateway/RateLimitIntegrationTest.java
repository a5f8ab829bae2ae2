package com.warden.gateway;

import static org.hamcrest.Matchers.oneOf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(properties = {
        "warden.rate-limit.max-requests=3",
        "warden.rate-limit.window=20s",
        "warden.seed.enabled=false",
        "spring.datasource.url=jdbc:h2:mem:warden-rate-limit;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000"
})
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Rate limiting through the gateway")
class RateLimitIntegrationTest {

    @Autowired private MockMvc mockMvc;

    @Test
    @DisplayName("the fourth request in a window gets 429 and other clients are unaffected")
    void fourthRequestRejected() throws Exception {
        for (int i = 0; i < 3; i++) {
            mockMvc.perform(get("/guest-demo").with(request -> {
                request.setRemoteAddr("198.51.100.10");
                return request;
            })).andExpect(status().isOk());
        }

        mockMvc.perform(get("/guest-demo").with(request -> {
                    request.setRemoteAddr("198.51.100.10");
                    return request;
                }))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", oneOf("19", "20")));

        mockMvc.perform(get("/guest-demo").with(request -> {
            request.setRemoteAddr("198.51.100.11");
            return request;
        })).andExpect(status().isOk());
    }

    @Test
    @DisplayName("the rate check runs before credentials are looked at")
    void rateCheckBeforeCredentials() throws Exception {
        for (int i = 0; i < 3; i++) {
            mockMvc.perform(get("/api/protected/data").with(request -> {
                request.setRemoteAddr("198.51.100.20");
                return request;
            })).andExpect(status().isUnauthorized());
        }

        mockMvc.perform(get("/api/protected/data").with(request -> {
            request.setRemoteAddr("198.51.100.20");
            return request;
        })).andExpect(status().isTooManyRequests());
    }
}
