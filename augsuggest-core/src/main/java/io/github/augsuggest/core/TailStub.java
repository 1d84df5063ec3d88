package io.github.augsuggest.core;

/// Membership of a [Tail] at one group position, in the order its leaves were read.
///
/// @param tailIndex index of the tail within its group
record TailStub(int tailIndex) {}
