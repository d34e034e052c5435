package io.constela.core.model;

/**
 * Value of an element or component prop: either an {@link Expression} or an {@link EventHandler}.
 */
public sealed interface PropValue permits Expression, EventHandler {}
