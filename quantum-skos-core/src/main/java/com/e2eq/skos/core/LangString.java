package com.e2eq.skos.core;

/**
 * A literal value with its language tag.
 */
public record LangString(String text, String language) {}
