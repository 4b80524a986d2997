package com.threadsmith.web;

import com.threadsmith.config.ThreadsmithRuntimeProperties;
import com.threadsmith.controller.PersonalityController;
import com.threadsmith.controller.ServiceInfoController;
import com.threadsmith.controller.dto.ServiceInfoResponses.HealthResponse;
import com.threadsmith.controller.dto.ServiceInfoResponses.ServiceDescriptionResponse;
import com.threadsmith.service.PersonalityStore;
import com.threadsmith.service.ServiceInfoService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({ServiceInfoController.class, PersonalityController.class})
@Import({ApiKeyConfig.class, ThreadsmithRuntimeProperties.class})
class ApiKeyInterceptorWebMvcTest {

    private static final String API_KEY = "s3cret-key";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ThreadsmithRuntimeProperties runtimeProperties;

    @MockitoBean
    private ServiceInfoService serviceInfoService;

    @MockitoBean
    private PersonalityStore personalityStore;

    @BeforeEach
    void setUp() {
        runtimeProperties.getSecurity().setApiKey(API_KEY);
    }

    @AfterEach
    void tearDown() {
        runtimeProperties.getSecurity().setApiKey("");
    }

    @Test
    void apiRouteWithoutKeyIsForbidden() throws Exception {
        mockMvc.perform(post("/api/personality/delete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"telegram_id\":1,\"name\":\"pirate\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("auth_error"));

        verifyNoInteractions(personalityStore);
    }

    @Test
    void apiRouteWithWrongKeyIsForbidden() throws Exception {
        mockMvc.perform(get("/api/personalities")
                        .param("telegram_id", "1")
                        .header("X-API-Key", "guess"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("auth_error"));
    }

    @Test
    void healthAndRootStayOpen() throws Exception {
        when(serviceInfoService.health())
                .thenReturn(new HealthResponse("healthy", "reddit-scraper-api", "1.0.0"));
        when(serviceInfoService.describe())
                .thenReturn(new ServiceDescriptionResponse("Reddit Scraper API", "1.0.0", Map.of()));

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/"))
                .andExpect(status().isOk());
    }

    @Test
    void correctKeyPassesInterceptor() throws Exception {
        when(personalityStore.listPersonalities(1L)).thenReturn(List.of());

        mockMvc.perform(get("/api/personalities")
                        .param("telegram_id", "1")
                        .header("X-API-Key", API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.personalities.length()").value(0));
    }
}
