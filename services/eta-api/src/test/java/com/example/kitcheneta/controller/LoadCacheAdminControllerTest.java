package com.example.kitcheneta.controller;

import com.example.kitcheneta.service.dto.LoadCacheStats;
import com.example.kitcheneta.service.load.LoadCacheService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class LoadCacheAdminControllerTest {

    @Mock
    private LoadCacheService loadCacheService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new LoadCacheAdminController(loadCacheService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void stats_Healthy() throws Exception {
        given(loadCacheService.stats()).willReturn(LoadCacheStats.healthy(2, 7));

        mockMvc.perform(get("/api/admin/load-cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cachedLocations").value(2))
                .andExpect(jsonPath("$.totalCachedOrders").value(7))
                .andExpect(jsonPath("$.cacheStatus").value("healthy"));
    }

    @Test
    void stats_Unavailable_StillReturns200() throws Exception {
        given(loadCacheService.stats()).willReturn(LoadCacheStats.unavailable("connection refused"));

        mockMvc.perform(get("/api/admin/load-cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cacheStatus").value("unavailable"))
                .andExpect(jsonPath("$.error").value("connection refused"));
    }

    @Test
    void resync_ReturnsAuthoritativeCount() throws Exception {
        given(loadCacheService.resync(3L)).willReturn(12L);

        mockMvc.perform(post("/api/admin/load-cache/3/resync"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.locationId").value(3))
                .andExpect(jsonPath("$.activeOrdersCount").value(12));
    }

    @Test
    void invalidate_Returns204() throws Exception {
        mockMvc.perform(delete("/api/admin/load-cache/3"))
                .andExpect(status().isNoContent());

        verify(loadCacheService).invalidate(3L);
    }
}
