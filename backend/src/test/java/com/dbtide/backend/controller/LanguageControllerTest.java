package com.dbtide.backend.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.dbtide.backend.dto.CompletionItem;
import com.dbtide.backend.dto.CompletionItem.CompletionKind;
import com.dbtide.backend.dto.CompletionResponse;
import com.dbtide.backend.dto.DefinitionResponse;
import com.dbtide.backend.dto.HoverResponse;
import com.dbtide.backend.exception.DocumentNotFoundException;
import com.dbtide.backend.service.LanguageFeatureService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = LanguageController.class)
class LanguageControllerTest {

  private static final String REQUEST = "{\"uri\":\"file:///a.sql\",\"line\":0,\"character\":3}";

  @Autowired private MockMvc mockMvc;

  @MockBean private LanguageFeatureService languageFeatureService;

  @Test
  void completionReturnsItems() throws Exception {
    when(languageFeatureService.completion(any()))
        .thenReturn(new CompletionResponse(List.of(new CompletionItem("if", CompletionKind.KEYWORD, null, "if"))));

    mockMvc
        .perform(post("/api/language/completion").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[0].label").value("if"))
        .andExpect(jsonPath("$.items[0].kind").value("KEYWORD"))
        .andExpect(jsonPath("$.items[0].detail").doesNotExist());
  }

  @Test
  void hoverWithoutResultOmitsContents() throws Exception {
    when(languageFeatureService.hover(any())).thenReturn(HoverResponse.none());

    mockMvc
        .perform(post("/api/language/hover").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.found").value(false))
        .andExpect(jsonPath("$.contents").doesNotExist());
  }

  @Test
  void definitionReturnsLocation() throws Exception {
    when(languageFeatureService.definition(any()))
        .thenReturn(DefinitionResponse.at("file:///macros/grants.sql", 0, 9, 0, 21));

    mockMvc
        .perform(post("/api/language/definition").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.uri").value("file:///macros/grants.sql"))
        .andExpect(jsonPath("$.startColumn").value(9));
  }

  @Test
  void unknownDocumentIsNotFound() throws Exception {
    when(languageFeatureService.hover(any())).thenThrow(new DocumentNotFoundException("file:///a.sql"));

    mockMvc
        .perform(post("/api/language/hover").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
        .andExpect(status().isNotFound());
  }

  @Test
  void blankUriIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/language/completion")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"uri\":\" \",\"line\":0,\"character\":0}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Validation error: uri - Document uri cannot be blank; "));
  }
}
