package com.crudadmin.backend.admin;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.crudadmin.backend.modules.auth.domain.NewUser;
import com.crudadmin.backend.modules.auth.domain.UserAccount;
import com.crudadmin.backend.modules.auth.infrastructure.crypto.BCryptPasswordHasher;
import com.crudadmin.backend.support.AuthFixtures;
import com.crudadmin.backend.support.InMemoryCredentialStore;
import com.crudadmin.backend.support.StandaloneServices;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

/**
 * Admin service request flows: same token format as the public API, with the admin capability required.
 */
class AdminServiceFlowTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockMvc mockMvc;
    private UserAccount root;
    private UserAccount alice;

    @BeforeEach
    void setUp() {
        InMemoryCredentialStore store = new InMemoryCredentialStore();
        BCryptPasswordHasher hasher = AuthFixtures.fastHasher();
        root = store.create(new NewUser("root", hasher.hash("root-password"), true));
        alice = store.create(new NewUser("alice", hasher.hash("alice-password"), false));

        mockMvc = StandaloneServices.adminService(store, hasher);
    }

    @Test
    void nonAdminCanLogInButIsForbiddenEverywhereElse() throws Exception {
        String token = login("alice", "alice-password");

        mockMvc.perform(get("/admin/users").header("Authorization", "Bearer " + token))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
        mockMvc.perform(get("/auth/me").header("Authorization", "Bearer " + token))
                .andExpect(status().isForbidden());
    }

    @Test
    void missingTokenIsUnauthorizedNotForbidden() throws Exception {
        mockMvc.perform(get("/admin/users"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("WWW-Authenticate", "Bearer"));
    }

    @Test
    void adminListsAndReadsUsers() throws Exception {
        String token = login("root", "root-password");

        mockMvc.perform(get("/admin/users").param("page", "0").param("size", "10")
                        .header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items", hasSize(2)))
                .andExpect(jsonPath("$.items[0].username").value("root"))
                .andExpect(jsonPath("$.items[1].is_admin").value(false))
                .andExpect(jsonPath("$.total_elements").value(2));

        mockMvc.perform(get("/admin/users/{id}", alice.id()).header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("alice"));
        mockMvc.perform(get("/admin/users/{id}", 999).header("Authorization", "Bearer " + token))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("admin.user_not_found"));
    }

    @Test
    void promotionTakesEffectOnExistingToken() throws Exception {
        String rootToken = login("root", "root-password");
        String aliceToken = login("alice", "alice-password");

        mockMvc.perform(patch("/admin/users/{id}/role", alice.id())
                        .header("Authorization", "Bearer " + rootToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"is_admin\":true}"))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/admin/users").header("Authorization", "Bearer " + aliceToken))
                .andExpect(status().isOk());
    }

    @Test
    void adminCannotDemoteOrDeleteSelf() throws Exception {
        String token = login("root", "root-password");

        mockMvc.perform(patch("/admin/users/{id}/role", root.id())
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"is_admin\":false}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("admin.self_demotion"));
        mockMvc.perform(delete("/admin/users/{id}", root.id()).header("Authorization", "Bearer " + token))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("admin.self_delete"));
    }

    @Test
    void deletedUsersTokenStopsWorking() throws Exception {
        String rootToken = login("root", "root-password");
        String aliceToken = login("alice", "alice-password");

        mockMvc.perform(delete("/admin/users/{id}", alice.id()).header("Authorization", "Bearer " + rootToken))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/auth/me").header("Authorization", "Bearer " + aliceToken))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_ACCESS_TOKEN"));
    }

    @Test
    void adminCreatesUsersAndResetsPasswords() throws Exception {
        String token = login("root", "root-password");

        mockMvc.perform(post("/admin/users")
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"carol\",\"password\":\"carol-password\",\"is_admin\":true}"))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "/admin/users/3"))
                .andExpect(jsonPath("$.is_admin").value(true));
        mockMvc.perform(post("/admin/users")
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"dave\",\"password\":\"short\"}"))
                .andExpect(status().isUnprocessableEntity());

        mockMvc.perform(put("/admin/users/{id}/password", alice.id())
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"new_password\":\"reset-password-1\"}"))
                .andExpect(status().isNoContent());
        login("alice", "reset-password-1");
    }

    private String login(String username, String password) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("username", username)
                        .param("password", password))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).path("access_token").asText();
    }
}
