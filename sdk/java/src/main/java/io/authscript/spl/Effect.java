package io.authscript.spl;

/**
 * The outcome a policy rule grants when it matches.
 */
public enum Effect {
    ALLOW,
    DENY
}
