package com.teamcode.backend.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
public class User {

    public static final String EMAIL_REGEX = "^[\\w+\\-.]+@[a-z\\d\\-]+(\\.[a-z\\d\\-]+)*\\.[a-z]+$";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Column(nullable = false)
    private String name;

    // BCrypt hash once the user went through UserService
    @NotBlank
    @Column(nullable = false)
    private String password;

    @NotBlank
    @Email(regexp = EMAIL_REGEX, flags = jakarta.validation.constraints.Pattern.Flag.CASE_INSENSITIVE)
    @Column(unique = true, nullable = false)
    private String email;

    @NotNull
    @Column(nullable = false)
    private Boolean teacher;

    @NotNull
    @Column(nullable = false)
    private Boolean admin;

    @NotBlank
    @Column(name = "anonymous_id", unique = true, nullable = false, updatable = false)
    private String anonymousId;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @OneToMany(mappedBy = "owner")
    private List<Team> teamsCreated = new ArrayList<>();

    @ManyToMany(mappedBy = "users")
    private Set<Team> teams = new LinkedHashSet<>();

    @OneToMany(mappedBy = "user")
    private List<Exercise> exercises = new ArrayList<>();

    @OneToMany(mappedBy = "user")
    private List<Answer> answers = new ArrayList<>();

    @Builder
    public User(String name, String password, String email, Boolean teacher, Boolean admin) {
        this.name = name;
        this.password = password;
        this.email = email;
        this.teacher = teacher;
        this.admin = admin;
    }

    @PrePersist
    public void onPersist() {
        generateAnonymousId();
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    /**
     * Assigns the opaque anonymous identifier. A value that is already set is never replaced.
     */
    public void generateAnonymousId() {
        if (anonymousId == null || anonymousId.isBlank()) {
            anonymousId = UUID.randomUUID().toString().replace("-", "");
        }
    }

    public boolean isOwner(Team team) {
        if (team == null || team.getOwner() == null) {
            return false;
        }
        User owner = team.getOwner();
        return owner == this || (id != null && id.equals(owner.getId()));
    }

    public boolean isTeacherOrAdmin() {
        return Boolean.TRUE.equals(teacher) || Boolean.TRUE.equals(admin);
    }

    public String getRoleKey() {
        if (Boolean.TRUE.equals(admin)) {
            return "ROLE_ADMIN";
        }
        return Boolean.TRUE.equals(teacher) ? "ROLE_TEACHER" : "ROLE_USER";
    }
}
