package com.acme.grc.hierarchy;

/**
 * Structural invariant violation in an assessment tree: duplicate or non-nested aliases, or colliding
 * sibling labels. Fatal to the build of that assessment.
 */
public class AliasCollisionException extends IllegalStateException {
    private final String alias;

    public AliasCollisionException(String alias, String message) {
        super(message);
        this.alias = alias;
    }

    public String alias() { return alias; }
}
