package io.newsdigest.pipeline.api;

import io.newsdigest.pipeline.api.dto.TagRequest;
import io.newsdigest.pipeline.api.exception.TagNotFoundException;
import io.newsdigest.pipeline.api.exception.ValidationException;
import io.newsdigest.pipeline.api.service.TagService;
import io.newsdigest.pipeline.model.Tag;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TagController.class)
class TagControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TagService tagService;

    @Test
    @DisplayName("Should create a tag and answer 201")
    void shouldCreateTag() throws Exception {
        when(tagService.create(any(TagRequest.class))).thenReturn(tag(3L, "tech"));

        mockMvc.perform(post("/api/v1/tags")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"tech\",\"color\":\"#1F6FEB\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(3))
                .andExpect(jsonPath("$.name").value("tech"));
    }

    @Test
    @DisplayName("Should answer 400 for a duplicate tag name")
    void shouldRejectDuplicateName() throws Exception {
        when(tagService.create(any(TagRequest.class)))
                .thenThrow(new ValidationException("Tag with name 'tech' already exists", Map.of("name", "tech")));

        mockMvc.perform(post("/api/v1/tags")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"tech\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.details.name").value("tech"));
    }

    @Test
    @DisplayName("Should answer 404 when deleting an unknown tag")
    void shouldReportUnknownTag() throws Exception {
        doThrow(new TagNotFoundException(9L)).when(tagService).delete(9L);

        mockMvc.perform(delete("/api/v1/tags/9"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should replace the tags of a feed")
    void shouldAssignTags() throws Exception {
        when(tagService.assignToFeed(7L, Set.of(1L, 2L))).thenReturn(List.of(tag(2L, "science"), tag(1L, "tech")));

        mockMvc.perform(put("/api/v1/tags/feed/7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tag_ids\":[1,2]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("science"))
                .andExpect(jsonPath("$[1].name").value("tech"));
    }

    @Test
    @DisplayName("Should require tag_ids on assignment")
    void shouldRequireTagIds() throws Exception {
        mockMvc.perform(put("/api/v1/tags/feed/7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    private static Tag tag(long id, String name) {
        Tag tag = new Tag(name, null, null);
        ReflectionTestUtils.setField(tag, "id", id);
        return tag;
    }
}
