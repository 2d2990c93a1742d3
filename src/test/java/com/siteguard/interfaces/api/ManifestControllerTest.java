package com.siteguard.interfaces.api;

import com.siteguard.application.ManifestIngestionService;
import com.siteguard.application.ModuleCatalogQueryService;
import com.siteguard.application.exceptions.CatalogConflictException;
import com.siteguard.application.exceptions.FieldViolation;
import com.siteguard.application.exceptions.ManifestValidationException;
import com.siteguard.application.exceptions.ModuleNotFoundException;
import com.siteguard.application.exceptions.SiteAccessDeniedException;
import com.siteguard.application.exceptions.TransientStorageException;
import com.siteguard.interfaces.api.dto.ManifestSubmissionResponse;
import com.siteguard.interfaces.api.exception.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ManifestControllerTest {

    private static final String BODY = "{\"site\": {\"id\": \"7f1d2c8e-2a4b-4c1e-9d3f-0b8e6a5c4d21\"}, \"modules\": []}";

    @Mock
    private ManifestIngestionService ingestionService;
    @Mock
    private ModuleCatalogQueryService catalogQueryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
            .standaloneSetup(new ManifestController(ingestionService), new ModuleCatalogController(catalogQueryService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("accepted manifest returns the submission summary")
    void accepted() throws Exception {
        UUID siteId = UUID.randomUUID();
        when(ingestionService.submit(BODY)).thenReturn(ManifestSubmissionResponse.builder()
            .siteId(siteId)
            .changed(true)
            .modulesProcessed(0)
            .securityScore(100)
            .build());

        mockMvc.perform(post("/api/v1/manifests").contentType(MediaType.APPLICATION_JSON).content(BODY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.siteId").value(siteId.toString()))
            .andExpect(jsonPath("$.changed").value(true))
            .andExpect(jsonPath("$.securityScore").value(100));
    }

    @Test
    @DisplayName("validation failures return 400 with field paths")
    void validationFailure() throws Exception {
        when(ingestionService.submit(anyString())).thenThrow(new ManifestValidationException("Manifest contains 1 invalid field(s)",
            List.of(new FieldViolation("modules[3].version", "must not be blank", ""))));

        mockMvc.perform(post("/api/v1/manifests").contentType(MediaType.APPLICATION_JSON).content(BODY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value(400))
            .andExpect(jsonPath("$.validationErrors[0].field").value("modules[3].version"))
            .andExpect(jsonPath("$.validationErrors[0].message").value("must not be blank"));
    }

    @Test
    @DisplayName("denied submissions return 403")
    void denied() throws Exception {
        when(ingestionService.submit(anyString())).thenThrow(new SiteAccessDeniedException(UUID.randomUUID(), "denied"));

        mockMvc.perform(post("/api/v1/manifests").contentType(MediaType.APPLICATION_JSON).content(BODY))
            .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("transient storage failures return 503 with a retry hint")
    void transientFailure() throws Exception {
        when(ingestionService.submit(anyString())).thenThrow(
            new TransientStorageException("Storage temporarily unavailable", new CannotAcquireLockException("timeout")));

        mockMvc.perform(post("/api/v1/manifests").contentType(MediaType.APPLICATION_JSON).content(BODY))
            .andExpect(status().isServiceUnavailable())
            .andExpect(header().exists("Retry-After"))
            .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    @DisplayName("unresolved catalog conflicts return 409")
    void conflict() throws Exception {
        when(ingestionService.submit(anyString())).thenThrow(new CatalogConflictException("Could not reconcile", null));

        mockMvc.perform(post("/api/v1/manifests").contentType(MediaType.APPLICATION_JSON).content(BODY))
            .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("unknown modules return 404")
    void unknownModule() throws Exception {
        when(catalogQueryService.listVersions("nope")).thenThrow(new ModuleNotFoundException("nope"));

        mockMvc.perform(get("/api/v1/modules/nope/versions"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("unknown category and sort field return 400")
    void badQueryParameters() throws Exception {
        mockMvc.perform(get("/api/v1/modules").param("category", "theme"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Unknown category: theme"));
        mockMvc.perform(get("/api/v1/modules").param("sort", "createdAt"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Unsupported sort field: createdAt"));

        verifyNoInteractions(catalogQueryService);
    }

    @Test
    @DisplayName("unexpected illegal arguments return 500 without their message")
    void internalIllegalArgument() throws Exception {
        when(ingestionService.submit(anyString())).thenThrow(
            new IllegalArgumentException("column sort_key rejected value for module_versions"));

        mockMvc.perform(post("/api/v1/manifests").contentType(MediaType.APPLICATION_JSON).content(BODY))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.message").value("An unexpected error occurred. Please contact support."))
            .andExpect(content().string(not(containsString("sort_key"))));
    }
}
