package com.teamcode.backend.config;

import com.teamcode.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
@Slf4j
public class AdminBootstrap implements ApplicationRunner {

    private final UserRepository userRepository;

    @Value("${admin.bootstrap.email:}")
    private String adminEmail;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (adminEmail == null || adminEmail.isBlank()) {
            return;
        }
        userRepository.findByEmail(adminEmail.trim().toLowerCase())
                .ifPresentOrElse(user -> {
                    if (Boolean.TRUE.equals(user.getAdmin()) && Boolean.TRUE.equals(user.getTeacher())) {
                        log.info("[ADMIN_BOOTSTRAP] User {} already has admin role", adminEmail);
                        return;
                    }
                    user.setAdmin(true);
                    user.setTeacher(true);
                    userRepository.save(user);
                    log.info("[ADMIN_BOOTSTRAP] Elevated user {} to admin", adminEmail);
                }, () -> log.warn("[ADMIN_BOOTSTRAP] User with email {} not found", adminEmail));
    }
}
