package com.anime.tracker.catalogue.api;

import com.anime.tracker.catalogue.exception.ForeignKeyViolationException;
import com.anime.tracker.catalogue.model.AnimeSnapshot;
import com.anime.tracker.catalogue.model.UserFavorite;
import com.anime.tracker.catalogue.service.IdentityStore;
import com.anime.tracker.catalogue.service.UserRelationStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(UserLibraryController.class)
class UserLibraryControllerTest {
    private static final AnimeSnapshot NARUTO = new AnimeSnapshot("naruto", "Naruto", "https://img.example/naruto.jpg");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private UserRelationStore userRelationStore;

    @MockBean
    private IdentityStore identityStore;

    @Test
    void addsFavorite() throws Exception {
        UserFavorite favorite = new UserFavorite();
        favorite.setUserId(7L);
        favorite.setAnimeSlug("naruto");
        favorite.setAnimeTitle("Naruto");
        given(userRelationStore.addFavorite(7L, NARUTO)).willReturn(favorite);

        mockMvc.perform(post("/api/users/7/favorites")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"animeSlug\":\"naruto\",\"animeTitle\":\"Naruto\",\"thumbnail\":\"https://img.example/naruto.jpg\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.animeSlug").value("naruto"));
    }

    @Test
    void unknownUserIs422() throws Exception {
        given(userRelationStore.addFavorite(99L, NARUTO))
                .willThrow(new ForeignKeyViolationException("No user with id 99"));

        mockMvc.perform(post("/api/users/99/favorites")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"animeSlug\":\"naruto\",\"animeTitle\":\"Naruto\",\"thumbnail\":\"https://img.example/naruto.jpg\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.message").value("No user with id 99"));
    }

    @Test
    void reportsFavoriteState() throws Exception {
        given(userRelationStore.isFavorite(7L, "naruto")).willReturn(true);

        mockMvc.perform(get("/api/users/7/favorites/naruto"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.favorite").value(true));
    }

    @Test
    void removingAMissingSubscriptionIs404() throws Exception {
        given(userRelationStore.unsubscribe(7L, "naruto")).willReturn(false);

        mockMvc.perform(delete("/api/users/7/subscriptions/naruto")).andExpect(status().isNotFound());
    }

    @Test
    void deletesUser() throws Exception {
        given(identityStore.deleteUser(7L)).willReturn(true);

        mockMvc.perform(delete("/api/users/7")).andExpect(status().isNoContent());
    }
}
