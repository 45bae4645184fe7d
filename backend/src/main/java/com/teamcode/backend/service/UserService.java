package com.teamcode.backend.service;

import com.teamcode.backend.dto.SaveResult;
import com.teamcode.backend.dto.SignupRequest;
import com.teamcode.backend.entity.Team;
import com.teamcode.backend.entity.User;
import com.teamcode.backend.exception.BizException;
import com.teamcode.backend.repository.TeamRepository;
import com.teamcode.backend.repository.UserRepository;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    static final String EMAIL_TAKEN_MESSAGE = "has already been taken";

    private final UserRepository userRepository;
    private final TeamRepository teamRepository;
    private final PasswordEncoder passwordEncoder;
    private final EntityValidator entityValidator;
    private final EntityManager entityManager;

    /**
     * Checks presence, email format and email uniqueness. Emails are compared case-insensitively.
     */
    @Transactional(readOnly = true)
    public Map<String, List<String>> validate(User user) {
        Map<String, List<String>> errors = entityValidator.validate(user);
        if (user.getEmail() != null && !user.getEmail().isBlank() && isEmailTaken(user)) {
            errors.computeIfAbsent("email", key -> new ArrayList<>()).add(EMAIL_TAKEN_MESSAGE);
        }
        return errors;
    }

    /**
     * Normalizes the email, generates the anonymous id when missing, validates and persists.
     * An invalid user is returned unsaved together with its violations; a stored user is detached
     * so its rejected changes are never written.
     * <p>
     * Not transactional itself, so a lost race on the unique email rolls back only the write
     * and is reported as a taken email.
     */
    public SaveResult<User> save(User user) {
        normalizeEmail(user);
        user.generateAnonymousId();
        Map<String, List<String>> errors = validate(user);
        if (!errors.isEmpty()) {
            return reject(user, errors);
        }
        try {
            return SaveResult.saved(userRepository.saveAndFlush(user));
        } catch (DataIntegrityViolationException ex) {
            log.warn("Email {} was taken concurrently", user.getEmail());
            Map<String, List<String>> conflict = new TreeMap<>();
            conflict.put("email", new ArrayList<>(List.of(EMAIL_TAKEN_MESSAGE)));
            return reject(user, conflict);
        }
    }

    private SaveResult<User> reject(User user, Map<String, List<String>> errors) {
        log.debug("Rejected user {}: {}", user.getEmail(), errors);
        if (user.getId() != null && entityManager.contains(user)) {
            entityManager.detach(user);
        }
        return SaveResult.rejected(user, errors);
    }

    public SaveResult<User> register(SignupRequest req) {
        String rawPassword = req.password();
        User user = User.builder()
                .name(req.name() == null ? null : req.name().trim())
                .email(req.email())
                .password(rawPassword == null || rawPassword.isBlank() ? rawPassword : passwordEncoder.encode(rawPassword))
                .teacher(false)
                .admin(false)
                .build();

        SaveResult<User> result = save(user);
        if (result.isSaved()) {
            log.info("Registered user {} (anonymous id {})", result.entity().getId(), result.entity().getAnonymousId());
        }
        return result;
    }

    @Transactional(readOnly = true)
    public User getUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new BizException("USER_NOT_FOUND", "User not found: " + userId));
    }

    @Transactional(readOnly = true)
    public User getUserByEmail(String email) {
        return userRepository.findByEmail(normalize(email))
                .orElseThrow(() -> new BizException("USER_NOT_FOUND", "User not found: " + email));
    }

    /**
     * Teams the user owns plus teams the user is a member of, without duplicates.
     */
    @Transactional(readOnly = true)
    public List<Team> teamsFromWhereBelongs(User user) {
        return teamRepository.findAllWhereBelongs(user);
    }

    private boolean isEmailTaken(User user) {
        if (user.getId() == null) {
            return userRepository.existsByEmailIgnoreCase(user.getEmail());
        }
        return userRepository.existsByEmailIgnoreCaseAndIdNot(user.getEmail(), user.getId());
    }

    private void normalizeEmail(User user) {
        if (user.getEmail() != null) {
            user.setEmail(normalize(user.getEmail()));
        }
    }

    static String normalize(String email) {
        return email == null ? null : email.trim().toLowerCase();
    }
}
