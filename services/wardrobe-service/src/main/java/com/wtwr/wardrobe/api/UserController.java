package com.wtwr.wardrobe.api;

import com.wtwr.wardrobe.api.dto.UserResponse;
import com.wtwr.wardrobe.domain.UserService;
import com.wtwr.wardrobe.infrastructure.web.Reply;
import com.wtwr.wardrobe.infrastructure.web.RequestPipeline;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
public class UserController {

    private final RequestPipeline pipeline;
    private final UserService users;

    public UserController(RequestPipeline pipeline, UserService users) {
        this.pipeline = pipeline;
        this.users = users;
    }

    @GetMapping("/me")
    public ResponseEntity<?> currentUser(HttpServletRequest request) {
        return pipeline.runAuthenticated(request,
                caller -> users.findById(caller.subject()).map(user -> Reply.ok(UserResponse.from(user))));
    }

    @PatchMapping("/me")
    public ResponseEntity<?> updateProfile(
            @RequestBody(required = false) Map<String, Object> body, HttpServletRequest request) {
        return pipeline.runAuthenticated(RouteSchemas.UPDATE_PROFILE, body, Map.of(), request,
                (caller, input) -> users.updateProfile(caller.subject(), input)
                        .map(user -> Reply.ok(UserResponse.from(user))));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<?> user(@PathVariable String userId, HttpServletRequest request) {
        return pipeline.runAuthenticated(RouteSchemas.USER_ID, Map.of(), Map.of("userId", userId), request,
                (caller, input) -> users.findById(input.string("userId"))
                        .map(user -> Reply.ok(UserResponse.from(user))));
    }
}
