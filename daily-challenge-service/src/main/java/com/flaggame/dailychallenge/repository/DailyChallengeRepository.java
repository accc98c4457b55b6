package com.flaggame.dailychallenge.repository;

import com.flaggame.dailychallenge.entity.DailyChallenge;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface DailyChallengeRepository extends JpaRepository<DailyChallenge, Long> {

    Optional<DailyChallenge> findByDate(LocalDate date);

    long countByDate(LocalDate date);

    Page<DailyChallenge> findByDateBeforeOrderByDateDesc(LocalDate date, Pageable pageable);
}
