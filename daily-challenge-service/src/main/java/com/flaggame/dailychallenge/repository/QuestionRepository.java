package com.flaggame.dailychallenge.repository;

import com.flaggame.dailychallenge.entity.Question;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface QuestionRepository extends JpaRepository<Question, Long> {

    Optional<Question> findByChallengeId(Long challengeId);

    List<Question> findByChallengeIdIn(Collection<Long> challengeIds);
}
