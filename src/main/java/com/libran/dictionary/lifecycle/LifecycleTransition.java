package com.libran.dictionary.lifecycle;

import java.time.Instant;

/**
 * One recorded state change of a manifest.
 */
public record LifecycleTransition(LifecycleState from, LifecycleState to, Instant at) {
}
