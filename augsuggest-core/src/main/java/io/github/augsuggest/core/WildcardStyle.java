package io.github.augsuggest.core;

/// Token that replaces a purely numeric position marker (`/N`) in rendered paths and in
/// simplified tails.
public enum WildcardStyle {

    /// `seq::*`, understood by augeas 1.13.0 and later.
    SEQUENCE("seq::*"),

    /// `*`, for older augeas releases.
    PLAIN("*");

    private final String token;

    WildcardStyle(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }
}
