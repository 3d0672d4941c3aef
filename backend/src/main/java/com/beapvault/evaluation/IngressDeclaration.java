package com.beapvault.evaluation;

/** Where the sender declares the package may have entered from. */
public record IngressDeclaration(IngressType type, String source, boolean verified) {
}
