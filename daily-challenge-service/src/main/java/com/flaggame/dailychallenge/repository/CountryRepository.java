package com.flaggame.dailychallenge.repository;

import com.flaggame.dailychallenge.entity.Country;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface CountryRepository extends JpaRepository<Country, Long> {

    Optional<Country> findByCode(String code);

    List<Country> findAllByOrderByCodeAsc();

    List<Country> findByDifficultyTierIgnoreCaseOrderByCodeAsc(String difficultyTier);

    List<Country> findByCodeInOrderByCodeAsc(Collection<String> codes);
}
