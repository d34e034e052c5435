package io.constela.core.compiled;

/** Lowered prop value: an expression or an event handler. */
public sealed interface CompiledPropValue permits CompiledExpression, CompiledEventHandler {}
