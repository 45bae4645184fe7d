package com.teamcode.backend.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "teams")
@Getter
@Setter
@NoArgsConstructor
public class Team {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Column(nullable = false)
    private String name;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "owner_id", nullable = false)
    private User owner;

    @ManyToMany
    @JoinTable(
            name = "teams_users",
            joinColumns = @JoinColumn(name = "team_id"),
            inverseJoinColumns = @JoinColumn(name = "user_id")
    )
    private Set<User> users = new LinkedHashSet<>();

    @ManyToMany
    @JoinTable(
            name = "exercises_teams",
            joinColumns = @JoinColumn(name = "team_id"),
            inverseJoinColumns = @JoinColumn(name = "exercise_id")
    )
    private Set<Exercise> exercises = new LinkedHashSet<>();

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    public Team(String name, User owner) {
        this.name = name;
        this.owner = owner;
    }

    @PrePersist
    public void onPersist() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public void addUser(User user) {
        users.add(user);
        user.getTeams().add(this);
    }

    public void addExercise(Exercise exercise) {
        exercises.add(exercise);
        exercise.getTeams().add(this);
    }

    public boolean hasMember(User user) {
        return users.stream().anyMatch(member -> member == user
                || (member.getId() != null && member.getId().equals(user.getId())));
    }

    /** Owner or member. */
    public boolean hasParticipant(User user) {
        return user.isOwner(this) || hasMember(user);
    }

    public boolean hasExercise(Exercise exercise) {
        return exercises.stream().anyMatch(e -> e == exercise
                || (e.getId() != null && e.getId().equals(exercise.getId())));
    }
}
