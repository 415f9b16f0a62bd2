package org.iceforge.warden.server.api;

import org.iceforge.warden.error.QueryExecutionException;
import org.iceforge.warden.permission.AccessibleTables;
import org.iceforge.warden.permission.PermissionEngine;
import org.iceforge.warden.permission.PermissionRecord;
import org.iceforge.warden.server.auth.AuthService;
import org.iceforge.warden.server.auth.AuthenticatedUser;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@RestController
@RequestMapping("/api/schema")
public class SchemaController {

    private final PermissionEngine permissions;
    private final AuthService auth;

    public SchemaController(PermissionEngine permissions, AuthService auth) {
        this.permissions = Objects.requireNonNull(permissions);
        this.auth = Objects.requireNonNull(auth);
    }

    /** Tables the caller may query, with their column allow-lists. Row filter text is not disclosed. */
    @GetMapping("/tables")
    public QueryApiModels.AccessibleTablesView tables(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        AuthenticatedUser caller = auth.authenticate(authorization);
        AccessibleTables access;
        try {
            access = permissions.accessibleTables(caller.userId());
        } catch (QueryExecutionException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), e);
        }
        List<QueryApiModels.TableAccessView> tables = new ArrayList<>();
        for (PermissionRecord r : access.grants()) {
            List<String> columns = r.columnFilter().restricted()
                    ? r.columnFilter().allowed().stream().sorted().toList() : null;
            tables.add(new QueryApiModels.TableAccessView(r.schemaName(), r.tableName(), columns,
                    r.rowFilter() != null));
        }
        return new QueryApiModels.AccessibleTablesView(caller.userId(), access.allTables(), tables);
    }
}
