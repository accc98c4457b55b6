package com.flaggame.dailychallenge.repository;

import com.flaggame.dailychallenge.entity.ChallengeAttempt;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ChallengeAttemptRepository extends JpaRepository<ChallengeAttempt, Long> {

    List<ChallengeAttempt> findByUserIdAndQuestionIdOrderByAttemptNumberDesc(Long userId, Long questionId);

    List<ChallengeAttempt> findByUserIdAndQuestionIdIn(Long userId, Collection<Long> questionIds);
}
