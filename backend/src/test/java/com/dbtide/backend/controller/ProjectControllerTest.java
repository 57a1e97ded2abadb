package com.dbtide.backend.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.dbtide.backend.dto.DbtProjectSpec;
import com.dbtide.backend.exception.ProjectLoadException;
import com.dbtide.backend.service.ProjectIndex;
import com.dbtide.backend.service.ProjectService;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = ProjectController.class)
class ProjectControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private ProjectService projectService;

  private static ProjectIndex index() {
    Path root = Path.of("shop").toAbsolutePath();
    return new ProjectIndex(
        root,
        new DbtProjectSpec("shop", null, null, null),
        Map.of("orders", root.resolve("models/orders.sql"), "customers", root.resolve("models/customers.sql")),
        List.of(),
        List.of());
  }

  @Test
  void summaryListsModels() throws Exception {
    when(projectService.index()).thenReturn(index());

    mockMvc
        .perform(get("/api/project"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("shop"))
        .andExpect(jsonPath("$.modelPaths[0]").value("models"))
        .andExpect(jsonPath("$.models[0]").value("customers"))
        .andExpect(jsonPath("$.models[1]").value("orders"));
  }

  @Test
  void reloadReturnsFreshSummary() throws Exception {
    when(projectService.reload()).thenReturn(index());

    mockMvc.perform(post("/api/project/reload")).andExpect(status().isOk()).andExpect(jsonPath("$.name").value("shop"));
  }

  @Test
  void failedReloadIsUnprocessable() throws Exception {
    when(projectService.reload()).thenThrow(new ProjectLoadException("Project file not found: dbt_project.yml"));

    mockMvc
        .perform(post("/api/project/reload"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.error").value("Project file not found: dbt_project.yml"))
        .andExpect(jsonPath("$.status").value(422));
  }
}
