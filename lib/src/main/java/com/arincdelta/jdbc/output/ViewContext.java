package com.arincdelta.jdbc.output;

/** The parts of a run's request that extra views may depend on. */
public record ViewContext(boolean regionRequested) {}
