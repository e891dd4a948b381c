package bflc.parser;

/** How the parser treats unmatched brackets. */
public enum ParseMode {
    /** End of input closes every open loop; a stray ']' ends the current scope, top level included. */
    PERMISSIVE,
    /** Unmatched '[' or ']' is a {@link ParseException}. */
    STRICT
}
