package com.beapvault.evaluation;

/** Where the sender declares data from the package may flow to. */
public record EgressDeclaration(EgressType type, String target, boolean required) {
}
