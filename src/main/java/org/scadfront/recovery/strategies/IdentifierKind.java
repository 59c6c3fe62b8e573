package org.scadfront.recovery.strategies;

/**
 * What a known identifier names.
 */
public enum IdentifierKind {
    VARIABLE,
    FUNCTION,
    MODULE
}
