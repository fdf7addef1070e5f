package com.wtwr.wardrobe.api;

import com.wtwr.wardrobe.api.dto.TokenResponse;
import com.wtwr.wardrobe.api.dto.UserResponse;
import com.wtwr.wardrobe.domain.UserService;
import com.wtwr.wardrobe.infrastructure.web.Reply;
import com.wtwr.wardrobe.infrastructure.web.RequestPipeline;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** Public account routes. */
@RestController
public class AuthController {

    private final RequestPipeline pipeline;
    private final UserService users;

    public AuthController(RequestPipeline pipeline, UserService users) {
        this.pipeline = pipeline;
        this.users = users;
    }

    @PostMapping("/signup")
    public ResponseEntity<?> signUp(
            @RequestBody(required = false) Map<String, Object> body, HttpServletRequest request) {
        return pipeline.run(RouteSchemas.SIGNUP, body, Map.of(), request,
                input -> users.signUp(input).map(user -> Reply.created(UserResponse.from(user))));
    }

    @PostMapping("/signin")
    public ResponseEntity<?> signIn(
            @RequestBody(required = false) Map<String, Object> body, HttpServletRequest request) {
        return pipeline.run(RouteSchemas.SIGNIN, body, Map.of(), request,
                input -> users.signIn(input).map(token -> Reply.ok(new TokenResponse(token))));
    }
}
