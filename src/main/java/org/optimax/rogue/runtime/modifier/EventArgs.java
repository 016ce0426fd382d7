package org.optimax.rogue.runtime.modifier;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Arguments passed to a {@link Modifier} for one event. Each {@link ModifierEvent} has its own
 * subclass.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
public abstract class EventArgs {
}
