package com.mikov.emailfinder.model;

public enum DomainSource {
    KNOWN_DB,
    SEARCH_FALLBACK,
    NAME_GUESS
}
