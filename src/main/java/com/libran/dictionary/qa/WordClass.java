package com.libran.dictionary.qa;

public enum WordClass {
    NOUN,
    VERB,
    ADJECTIVE,
    OTHER
}
