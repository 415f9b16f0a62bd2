package org.iceforge.warden.server.api;

import org.iceforge.warden.error.QueryExecutionException;
import org.iceforge.warden.permission.AccessibleTables;
import org.iceforge.warden.permission.ColumnFilter;
import org.iceforge.warden.permission.PermissionEngine;
import org.iceforge.warden.permission.PermissionRecord;
import org.iceforge.warden.permission.RowPredicateParser;
import org.iceforge.warden.server.auth.AuthService;
import org.iceforge.warden.server.auth.AuthenticatedUser;
import org.iceforge.warden.server.auth.UnauthorizedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class SchemaControllerTest {

    private PermissionEngine permissions;
    private AuthService auth;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        permissions = mock(PermissionEngine.class);
        auth = mock(AuthService.class);
        when(auth.authenticate("Bearer analyst-token")).thenReturn(new AuthenticatedUser("analyst", "ANALYST"));
        when(auth.authenticate("Bearer admin-token")).thenReturn(new AuthenticatedUser("admin", "ADMIN"));
        when(auth.authenticate(null)).thenThrow(new UnauthorizedException("missing bearer token"));
        mockMvc = MockMvcBuilders.standaloneSetup(new SchemaController(permissions, auth)).build();
    }

    @Test
    void listsGrantsWithColumnsButNotTheRowFilterText() throws Exception {
        when(permissions.accessibleTables("analyst")).thenReturn(new AccessibleTables("analyst", false, List.of(
                PermissionRecord.readOnly("analyst", "public", "customers")
                        .withColumns(ColumnFilter.allowOnly(List.of("region", "id", "name"))),
                PermissionRecord.readOnly("analyst", "public", "orders")
                        .withRowFilter(RowPredicateParser.parse("region = 'US'")))));

        mockMvc.perform(get("/api/schema/tables").header(HttpHeaders.AUTHORIZATION, "Bearer analyst-token"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value("analyst"))
                .andExpect(jsonPath("$.allTables").value(false))
                .andExpect(jsonPath("$.tables[0].table").value("customers"))
                .andExpect(jsonPath("$.tables[0].columns[0]").value("id"))
                .andExpect(jsonPath("$.tables[0].columns[2]").value("region"))
                .andExpect(jsonPath("$.tables[0].rowFiltered").value(false))
                .andExpect(jsonPath("$.tables[1].table").value("orders"))
                .andExpect(jsonPath("$.tables[1].columns").doesNotExist())
                .andExpect(jsonPath("$.tables[1].rowFiltered").value(true))
                .andExpect(content().string(not(containsString("'US'"))));
    }

    @Test
    void adminsSeeEveryTable() throws Exception {
        when(permissions.accessibleTables("admin")).thenReturn(AccessibleTables.everything("admin"));

        mockMvc.perform(get("/api/schema/tables").header(HttpHeaders.AUTHORIZATION, "Bearer admin-token"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allTables").value(true))
                .andExpect(jsonPath("$.tables").isEmpty());
    }

    @Test
    void storeOutageIs503() throws Exception {
        when(permissions.accessibleTables("analyst"))
                .thenThrow(QueryExecutionException.serverError("Authorization store unavailable", null));

        mockMvc.perform(get("/api/schema/tables").header(HttpHeaders.AUTHORIZATION, "Bearer analyst-token"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void anonymousCallerIs401() throws Exception {
        mockMvc.perform(get("/api/schema/tables"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(permissions);
    }
}
