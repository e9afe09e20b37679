package com.diffdash.extractor.static_analysis;

/**
 * The closed set of node kinds the extractor understands.
 * Anything else the grammar produces is carried as {@link #OTHER} with its children.
 */
public enum NodeKind {
    CLASS,      // [name, superclass | NIL, body...]
    MODULE,     // [name, body...]
    CALL,       // text = method; [receiver | NIL, args...]
    BLOCK,      // [call, body...]
    BEGIN,      // [statements...]
    CONST,      // text = simple name; [scope | NIL]
    CASGN,      // text = constant name; [scope | NIL, value]
    STR,        // text = literal value
    DSTR,       // [STR | interpolation...]
    SYM,        // text = name without the leading colon
    INT,
    IDENT,      // local variable or receiverless method reference
    IVAR,
    CVAR,
    GVAR,
    SELF,
    NIL,        // absent child
    OTHER       // text = grammar node type
}
