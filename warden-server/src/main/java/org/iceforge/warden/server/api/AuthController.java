package org.iceforge.warden.server.api;

import org.iceforge.warden.server.auth.AuthService;
import org.iceforge.warden.server.auth.AuthenticatedUser;
import org.iceforge.warden.server.auth.UnauthorizedException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.*;

import java.util.Objects;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthService auth;

    public AuthController(AuthService auth) {
        this.auth = Objects.requireNonNull(auth);
    }

    @PostMapping("/login")
    public QueryApiModels.LoginResponse login(@RequestBody(required = false) QueryApiModels.LoginRequest req) {
        if (req == null) throw new UnauthorizedException("username and password are required");
        AuthService.LoginResult result = auth.login(req.username(), req.password());
        return new QueryApiModels.LoginResponse(result.token().token(), "bearer", result.token().expiresInSeconds(),
                view(result.user()));
    }

    @GetMapping("/me")
    public QueryApiModels.UserView me(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return view(auth.authenticate(authorization));
    }

    static QueryApiModels.UserView view(AuthenticatedUser user) {
        return new QueryApiModels.UserView(user.userId(), user.role());
    }
}
