package com.flaggame.dailychallenge.repository;

import com.flaggame.dailychallenge.entity.UserStreakState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserStreakStateRepository extends JpaRepository<UserStreakState, Long> {

    Optional<UserStreakState> findByUserId(Long userId);
}
