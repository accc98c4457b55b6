package com.flaggame.dailychallenge.repository;

import com.flaggame.dailychallenge.entity.ShownInCycle;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Set;

@Repository
public interface ShownInCycleRepository extends JpaRepository<ShownInCycle, Long> {

    @Query("SELECT s.country.code FROM ShownInCycle s WHERE s.track.id = :trackId")
    Set<String> findShownCountryCodes(@Param("trackId") Long trackId);

    long countByTrackId(Long trackId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ShownInCycle s WHERE s.track.id = :trackId")
    int deleteAllForTrack(@Param("trackId") Long trackId);
}
