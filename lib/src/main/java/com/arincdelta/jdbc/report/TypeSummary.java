package com.arincdelta.jdbc.report;

/** Row counts of one record type. Counts are those of the base type, never of a derived view. */
public record TypeSummary(String typeCode, int current, int added, int removed, int modified) {}
