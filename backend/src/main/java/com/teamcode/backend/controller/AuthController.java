package com.teamcode.backend.controller;

import com.teamcode.backend.dto.LoginRequest;
import com.teamcode.backend.dto.SaveResult;
import com.teamcode.backend.dto.SignupRequest;
import com.teamcode.backend.dto.UserProfileDto;
import com.teamcode.backend.dto.ValidationErrorResponse;
import com.teamcode.backend.entity.User;
import com.teamcode.backend.service.AuthService;
import com.teamcode.backend.service.UserService;
import com.teamcode.backend.util.JwtProvider;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final JwtProvider jwtProvider;
    private final AuthService authService;
    private final UserService userService;

    @PostMapping("/signup")
    public ResponseEntity<?> signup(@Valid @RequestBody SignupRequest signupRequest) {
        SaveResult<User> result = userService.register(signupRequest);
        if (!result.isSaved()) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(ValidationErrorResponse.of(result.errors()));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(UserProfileDto.from(result.entity()));
    }

    @PostMapping("/login")
    public ResponseEntity<Map<String, String>> login(@Valid @RequestBody LoginRequest loginRequest) {
        User user = authService.login(loginRequest);

        Map<String, String> responseBody = new HashMap<>();
        responseBody.put("accessToken", jwtProvider.generateToken(user));
        return ResponseEntity.ok(responseBody);
    }
}
