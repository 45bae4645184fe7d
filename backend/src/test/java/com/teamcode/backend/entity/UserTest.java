package com.teamcode.backend.entity;

import com.teamcode.backend.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UserTest {

    @Test
    @DisplayName("generateAnonymousId fills an empty id")
    void generatesAnonymousId() {
        User user = Fixtures.buildUser();
        assertThat(user.getAnonymousId()).isNull();

        user.generateAnonymousId();

        assertThat(user.getAnonymousId()).isNotBlank();
    }

    @Test
    @DisplayName("generateAnonymousId keeps an id that is already set")
    void keepsExistingAnonymousId() {
        User user = Fixtures.buildUser();
        user.generateAnonymousId();
        String first = user.getAnonymousId();

        user.generateAnonymousId();
        user.onPersist();

        assertThat(user.getAnonymousId()).isEqualTo(first);
    }

    @Test
    @DisplayName("a blank anonymous id is replaced")
    void replacesBlankAnonymousId() {
        User user = Fixtures.buildUser();
        user.setAnonymousId("  ");

        user.generateAnonymousId();

        assertThat(user.getAnonymousId()).isNotBlank();
    }

    @Test
    @DisplayName("isOwner is true for the owner of the team")
    void ownerOfTeam() {
        User user = Fixtures.buildUser();
        Team team = new Team("Alpha", user);

        assertThat(user.isOwner(team)).isTrue();
    }

    @Test
    @DisplayName("isOwner is false for a team owned by somebody else")
    void notOwnerOfTeam() {
        User user = Fixtures.buildUser();
        Team team = new Team("Beta", Fixtures.buildUser());
        team.addUser(user);

        assertThat(user.isOwner(team)).isFalse();
        assertThat(team.hasParticipant(user)).isTrue();
    }

    @Test
    void roleKeyFollowsFlags() {
        User user = Fixtures.buildUser();
        assertThat(user.getRoleKey()).isEqualTo("ROLE_USER");

        user.setTeacher(true);
        assertThat(user.getRoleKey()).isEqualTo("ROLE_TEACHER");

        user.setAdmin(true);
        assertThat(user.getRoleKey()).isEqualTo("ROLE_ADMIN");
    }
}
