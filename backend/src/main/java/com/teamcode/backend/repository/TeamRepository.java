package com.teamcode.backend.repository;

import com.teamcode.backend.entity.Team;
import com.teamcode.backend.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface TeamRepository extends JpaRepository<Team, Long> {

    List<Team> findByOwner_IdOrderByIdAsc(Long ownerId);

    @Query("""
        SELECT DISTINCT t FROM Team t
        LEFT JOIN t.users u
        WHERE t.owner = :user OR u = :user
        ORDER BY t.id
        """)
    List<Team> findAllWhereBelongs(@Param("user") User user);
}
