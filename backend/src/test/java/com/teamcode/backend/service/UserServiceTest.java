package com.teamcode.backend.service;

import com.teamcode.backend.dto.SaveResult;
import com.teamcode.backend.dto.SignupRequest;
import com.teamcode.backend.entity.Team;
import com.teamcode.backend.entity.User;
import com.teamcode.backend.repository.UserRepository;
import com.teamcode.backend.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class UserServiceTest {

    @Autowired
    private UserService userService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @Autowired
    private Fixtures fixtures;

    private User user;

    @BeforeEach
    void setUp() {
        user = Fixtures.buildUser();
        user.generateAnonymousId();
    }

    @Test
    @DisplayName("a user with every attribute present is valid")
    void validWithValidAttributes() {
        assertThat(userService.validate(user)).isEmpty();
    }

    @Test
    void invalidWithEmptyName() {
        user.setName("");
        assertThat(userService.validate(user)).containsKey("name");
    }

    @Test
    void invalidWithEmptyPassword() {
        user.setPassword("");
        assertThat(userService.validate(user)).containsKey("password");
    }

    @Test
    void invalidWithEmptyEmail() {
        user.setEmail("");
        assertThat(userService.validate(user)).containsKey("email");
    }

    @Test
    @DisplayName("validation alone does not generate the anonymous id")
    void invalidWithEmptyAnonymousId() {
        user.setAnonymousId("");
        assertThat(userService.validate(user)).containsKey("anonymousId");
    }

    @Test
    void invalidWithEmptyTeacherFlag() {
        user.setTeacher(null);
        assertThat(userService.validate(user)).containsKey("teacher");
    }

    @Test
    void invalidWithEmptyAdminFlag() {
        user.setAdmin(null);
        assertThat(userService.validate(user)).containsKey("admin");
    }

    @Test
    @DisplayName("well-formed email addresses are accepted")
    void validEmailAddresses() {
        for (String address : List.of("user@example.com", "USER@foo.COM", "A_US-ER@foo.bar.org",
                "first.last@foo.jp", "alice+bob@baz.cn")) {
            user.setEmail(address);
            assertThat(userService.validate(user)).as(address).isEmpty();
        }
    }

    @Test
    @DisplayName("malformed email addresses are rejected")
    void invalidEmailAddresses() {
        for (String address : List.of("user@example,com", "user_at_foo.org", "user.name@example.",
                "foo@bar_baz.com", "foo@bar+baz.com", "user@example..com")) {
            user.setEmail(address);
            assertThat(userService.validate(user)).as(address).containsKey("email");
        }
    }

    @Test
    @DisplayName("an email already used by another user is rejected")
    void duplicatedEmail() {
        User other = Fixtures.buildUser();
        other.setEmail(user.getEmail());
        assertThat(userService.save(other).isSaved()).isTrue();

        assertThat(userService.validate(user).get("email")).contains(UserService.EMAIL_TAKEN_MESSAGE);
        assertThat(userService.save(user).isSaved()).isFalse();
    }

    @Test
    @DisplayName("email uniqueness ignores case")
    void duplicatedEmailWithDifferentCase() {
        User other = Fixtures.buildUser();
        other.setEmail("Alice@Example.com");
        userService.save(other);

        user.setEmail("alice@example.COM");

        assertThat(userService.validate(user)).containsKey("email");
    }

    @Test
    @DisplayName("a saved user can be validated again without clashing with itself")
    void savedUserStaysValid() {
        User saved = userService.save(user).entity();

        assertThat(userService.validate(saved)).isEmpty();
    }

    @Test
    @DisplayName("save generates the anonymous id")
    void saveGeneratesAnonymousId() {
        User fresh = Fixtures.buildUser();

        SaveResult<User> result = userService.save(fresh);

        assertThat(result.isSaved()).isTrue();
        assertThat(result.entity().getId()).isNotNull();
        assertThat(result.entity().getAnonymousId()).isNotBlank();
    }

    @Test
    @DisplayName("saving again keeps the anonymous id")
    void saveKeepsAnonymousId() {
        User saved = userService.save(Fixtures.buildUser()).entity();
        String anonymousId = saved.getAnonymousId();

        saved.setName("Renamed");
        userService.save(saved);

        assertThat(userRepository.findById(saved.getId()).orElseThrow().getAnonymousId()).isEqualTo(anonymousId);
    }

    @Test
    @DisplayName("a rejected save persists nothing")
    void rejectedSavePersistsNothing() {
        long before = userRepository.count();
        User invalid = Fixtures.buildUser();
        invalid.setName("");

        SaveResult<User> result = userService.save(invalid);

        assertThat(result.isSaved()).isFalse();
        assertThat(result.errors()).containsOnlyKeys("name");
        assertThat(userRepository.count()).isEqualTo(before);
    }

    @Test
    @DisplayName("an invalid change to a stored user is rejected and not written")
    void resaveStoredUserWithBlankName() {
        User saved = userService.save(Fixtures.buildUser()).entity();
        String name = saved.getName();

        saved.setName("");
        SaveResult<User> result = userService.save(saved);

        assertThat(result.isSaved()).isFalse();
        assertThat(result.errors()).containsOnlyKeys("name");
        assertThat(userRepository.findById(saved.getId()).orElseThrow().getName()).isEqualTo(name);
    }

    @Test
    @DisplayName("a stored user cannot take the email of another user")
    void resaveStoredUserWithTakenEmail() {
        User first = userService.save(Fixtures.buildUser()).entity();
        User second = userService.save(Fixtures.buildUser()).entity();
        String email = second.getEmail();

        second.setEmail(first.getEmail().toUpperCase());
        SaveResult<User> result = userService.save(second);

        assertThat(result.isSaved()).isFalse();
        assertThat(result.errors().get("email")).containsExactly(UserService.EMAIL_TAKEN_MESSAGE);
        assertThat(userRepository.findById(second.getId()).orElseThrow().getEmail()).isEqualTo(email);
    }

    @Test
    @DisplayName("validate reports problems without rewriting the email")
    void validateLeavesEmailUntouched() {
        user.setEmail(" Mixed@Example.com ");

        assertThat(userService.validate(user)).containsKey("email");
        assertThat(user.getEmail()).isEqualTo(" Mixed@Example.com ");
    }

    @Test
    @DisplayName("register stores a normalized email and an encoded password")
    void registerEncodesPassword() {
        SaveResult<User> result = userService.register(new SignupRequest("Ada", " Ada@Example.com ", "secret1"));

        assertThat(result.isSaved()).isTrue();
        User saved = result.entity();
        assertThat(saved.getEmail()).isEqualTo("ada@example.com");
        assertThat(saved.getPassword()).isNotEqualTo("secret1");
        assertThat(passwordEncoder.matches("secret1", saved.getPassword())).isTrue();
        assertThat(saved.getTeacher()).isFalse();
        assertThat(saved.getAdmin()).isFalse();
    }

    @Test
    @DisplayName("teamsFromWhereBelongs unites owned and joined teams")
    void teamsFromWhereBelongs() {
        User member = fixtures.user();
        fixtures.team(member);
        fixtures.team(fixtures.user(), member);
        fixtures.team(fixtures.user());

        List<Team> teams = userService.teamsFromWhereBelongs(member);

        assertThat(teams).hasSize(2);
    }

    @Test
    @DisplayName("a team the user both owns and joined is listed once")
    void teamsFromWhereBelongsWithoutDuplicates() {
        User owner = fixtures.user();
        fixtures.team(owner, owner);

        assertThat(userService.teamsFromWhereBelongs(owner)).hasSize(1);
    }
}
