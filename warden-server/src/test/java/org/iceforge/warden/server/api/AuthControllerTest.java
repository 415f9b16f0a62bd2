package org.iceforge.warden.server.api;

import org.iceforge.warden.server.auth.AuthService;
import org.iceforge.warden.server.auth.AuthenticatedUser;
import org.iceforge.warden.server.auth.IssuedToken;
import org.iceforge.warden.server.auth.UnauthorizedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AuthControllerTest {

    private AuthService auth;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        auth = mock(AuthService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new AuthController(auth)).build();
    }

    @Test
    void login_returnsBearerTokenAndUser() throws Exception {
        AuthenticatedUser user = new AuthenticatedUser("analyst", "ANALYST");
        when(auth.login("analyst", "s3cret")).thenReturn(new AuthService.LoginResult(user,
                new IssuedToken("h.p.s", Instant.parse("2024-05-01T10:30:00Z"), 1800)));

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"analyst\",\"password\":\"s3cret\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accessToken").value("h.p.s"))
                .andExpect(jsonPath("$.tokenType").value("bearer"))
                .andExpect(jsonPath("$.expiresIn").value(1800))
                .andExpect(jsonPath("$.user.userId").value("analyst"))
                .andExpect(jsonPath("$.user.role").value("ANALYST"));
    }

    @Test
    void login_badCredentials_is401WithChallenge() throws Exception {
        when(auth.login(any(), any())).thenThrow(new UnauthorizedException("Incorrect username or password"));

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"analyst\",\"password\":\"nope\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("WWW-Authenticate", "Bearer"));
    }

    @Test
    void me_returnsTheTokenOwner() throws Exception {
        when(auth.authenticate("Bearer h.p.s")).thenReturn(new AuthenticatedUser("admin", "ADMIN"));

        mockMvc.perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, "Bearer h.p.s"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value("admin"))
                .andExpect(jsonPath("$.role").value("ADMIN"));
    }

    @Test
    void me_withoutToken_is401() throws Exception {
        when(auth.authenticate(null)).thenThrow(new UnauthorizedException("missing bearer token"));

        mockMvc.perform(get("/api/auth/me"))
                .andExpect(status().isUnauthorized());
    }
}
