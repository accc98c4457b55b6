package com.flaggame.dailychallenge.repository;

import com.flaggame.dailychallenge.entity.RotationTrack;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface RotationTrackRepository extends JpaRepository<RotationTrack, Long> {

    Optional<RotationTrack> findByTrackKey(String trackKey);
}
