package com.gladlabs.orchestrator.dispatch.api;

import com.gladlabs.orchestrator.core.engine.ExecutionService;
import com.gladlabs.orchestrator.core.model.PhaseConfig;
import com.gladlabs.orchestrator.core.model.WorkflowDefinition;
import com.gladlabs.orchestrator.core.workflow.AvailablePhase;
import com.gladlabs.orchestrator.core.workflow.ValidationReport;
import com.gladlabs.orchestrator.core.workflow.WorkflowNotFoundException;
import com.gladlabs.orchestrator.core.workflow.WorkflowValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(WorkflowController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class WorkflowControllerTest {

    private static final String SOCIAL_POST = """
            {"name":"Social post","description":"Short post",
             "phases":[{"name":"draft","agent":"content","timeout_seconds":120,"quality_threshold":0.6}]}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ExecutionService executionService;

    @Test
    @DisplayName("GET /phases lists the phase catalog")
    void phases() throws Exception {
        when(executionService.listAvailablePhases()).thenReturn(List.of(
                new AvailablePhase("draft", "Write the article", "content", "content", 300, 2, List.of("content"))));

        mockMvc.perform(get("/api/v1/phases"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("draft"))
                .andExpect(jsonPath("$[0].default_timeout_seconds").value(300))
                .andExpect(jsonPath("$[0].default_retries").value(2));
    }

    @Test
    @DisplayName("GET /workflows and /workflows/{id} expose stored definitions")
    void workflows() throws Exception {
        var template = new WorkflowDefinition("blog_post", "Blog post", "Full article",
                List.of(PhaseConfig.of("draft", "content")), null, true, List.of());
        when(executionService.listWorkflows()).thenReturn(List.of(template));
        when(executionService.findWorkflow("blog_post")).thenReturn(Optional.of(template));
        when(executionService.findWorkflow("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/workflows"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].is_template").value(true));
        mockMvc.perform(get("/api/v1/workflows/blog_post"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phases[0].agent").value("content"));
        mockMvc.perform(get("/api/v1/workflows/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /workflows stores a valid definition and returns 201")
    void register() throws Exception {
        when(executionService.registerWorkflow(any(WorkflowDefinition.class)))
                .thenAnswer(inv -> ((WorkflowDefinition) inv.getArgument(0)).withId("wf-1"));

        mockMvc.perform(post("/api/v1/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SOCIAL_POST))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("wf-1"))
                .andExpect(jsonPath("$.phases[0].timeout_seconds").value(120))
                .andExpect(jsonPath("$.phases[0].quality_threshold").value(0.6));
    }

    @Test
    @DisplayName("POST /workflows with an invalid definition returns 400 and the report")
    void registerInvalid() throws Exception {
        when(executionService.registerWorkflow(any(WorkflowDefinition.class))).thenThrow(
                new WorkflowValidationException(ValidationReport.of(
                        List.of("Phase 'draft': unknown agent 'writer'"), List.of("Workflow has no description"))));

        mockMvc.perform(post("/api/v1/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SOCIAL_POST))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]").value("Phase 'draft': unknown agent 'writer'"))
                .andExpect(jsonPath("$.warnings[0]").value("Workflow has no description"));
    }

    @Test
    @DisplayName("POST /workflows/validate always answers 200 with the report")
    void validate() throws Exception {
        when(executionService.validateWorkflowDefinition(any(WorkflowDefinition.class)))
                .thenReturn(ValidationReport.of(List.of("Workflow name cannot be empty"), List.of()));

        mockMvc.perform(post("/api/v1/workflows/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"\",\"phases\":[]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.errors[0]").value("Workflow name cannot be empty"));
    }

    @Test
    @DisplayName("PUT /workflows/{id} replaces a custom definition under the same id")
    void update() throws Exception {
        when(executionService.updateWorkflow(eq("wf-1"), any(WorkflowDefinition.class)))
                .thenAnswer(inv -> ((WorkflowDefinition) inv.getArgument(1)).withId("wf-1"));

        mockMvc.perform(put("/api/v1/workflows/wf-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SOCIAL_POST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("wf-1"))
                .andExpect(jsonPath("$.name").value("Social post"));
    }

    @Test
    @DisplayName("PUT /workflows/{id} on a template is refused with 400")
    void updateTemplate() throws Exception {
        when(executionService.updateWorkflow(eq("blog_post"), any(WorkflowDefinition.class)))
                .thenThrow(new IllegalArgumentException("Built-in template cannot be replaced: blog_post"));

        mockMvc.perform(put("/api/v1/workflows/blog_post")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SOCIAL_POST))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("ValidationFailure"));
    }

    @Test
    @DisplayName("DELETE /workflows/{id} answers 204, or 404 when the id is unknown")
    void deleteWorkflow() throws Exception {
        mockMvc.perform(delete("/api/v1/workflows/wf-1"))
                .andExpect(status().isNoContent());
        verify(executionService).deleteWorkflow("wf-1");

        doThrow(new WorkflowNotFoundException("gone")).when(executionService).deleteWorkflow("gone");
        mockMvc.perform(delete("/api/v1/workflows/gone"))
                .andExpect(status().isNotFound());
    }
}
