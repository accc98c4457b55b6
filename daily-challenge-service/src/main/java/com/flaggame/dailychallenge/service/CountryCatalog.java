package com.flaggame.dailychallenge.service;

import com.flaggame.dailychallenge.entity.Country;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the country catalog used by the challenge engine.
 */
public interface CountryCatalog {

    List<Country> listAll();

    List<Country> listByTier(String tierLabel);

    List<Country> listByCodes(Collection<String> codes);

    Optional<Country> get(String code);
}
