package com.teamcode.backend.service;

import com.teamcode.backend.dto.LoginRequest;
import com.teamcode.backend.entity.User;
import com.teamcode.backend.exception.BizException;
import com.teamcode.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    @Transactional(readOnly = true)
    public User login(LoginRequest req) {
        User user = userRepository.findByEmail(UserService.normalize(req.email()))
                .orElseThrow(() -> new BizException("INVALID_CREDENTIALS", "Invalid email or password"));

        if (!passwordEncoder.matches(req.password(), user.getPassword())) {
            throw new BizException("INVALID_CREDENTIALS", "Invalid email or password");
        }
        return user;
    }
}
