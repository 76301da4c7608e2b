package dev.llmbench.catalog;

/** An illustrative input/expected pair attached to a coding prompt. */
public record CodeTestCase(String input, Object expected) {}
