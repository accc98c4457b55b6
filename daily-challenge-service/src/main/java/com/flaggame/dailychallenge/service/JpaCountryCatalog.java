package com.flaggame.dailychallenge.service;

import com.flaggame.dailychallenge.entity.Country;
import com.flaggame.dailychallenge.repository.CountryRepository;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Service
public class JpaCountryCatalog implements CountryCatalog {

    private final CountryRepository countryRepository;

    public JpaCountryCatalog(CountryRepository countryRepository) {
        this.countryRepository = countryRepository;
    }

    @Override
    public List<Country> listAll() {
        return countryRepository.findAllByOrderByCodeAsc();
    }

    @Override
    public List<Country> listByTier(String tierLabel) {
        return countryRepository.findByDifficultyTierIgnoreCaseOrderByCodeAsc(tierLabel);
    }

    @Override
    public List<Country> listByCodes(Collection<String> codes) {
        if (codes.isEmpty()) {
            return List.of();
        }
        return countryRepository.findByCodeInOrderByCodeAsc(codes);
    }

    @Override
    public Optional<Country> get(String code) {
        return countryRepository.findByCode(code);
    }
}
