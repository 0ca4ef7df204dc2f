package com.arincdelta.jdbc.output;

/** Derives additional output subsets for a record type from its already projected rows. */
@FunctionalInterface
public interface ExtraViewHandler {

    ExtraViews apply(TypeDelta delta, ViewContext context);
}
