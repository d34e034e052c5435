package io.constela.core.error;

/** Diagnostic codes emitted by analysis. The constant name is the wire value. */
public enum ErrorCode {

    // ── reference errors ──
    UNDEFINED_STATE,
    UNDEFINED_ACTION,
    UNDEFINED_VAR,
    UNDEFINED_PARAM,
    UNDEFINED_ROUTE_PARAM,
    UNDEFINED_IMPORT,
    UNDEFINED_DATA,
    UNDEFINED_REF,
    UNDEFINED_STYLE,
    UNDEFINED_VARIANT,
    UNDEFINED_LOCAL_STATE,
    COMPONENT_NOT_FOUND,

    // ── declaration missing ──
    ROUTE_NOT_DEFINED,
    IMPORTS_NOT_DEFINED,
    DATA_NOT_DEFINED,

    // ── structural / semantic ──
    DUPLICATE_ACTION,
    COMPONENT_CYCLE,
    COMPONENT_PROP_MISSING,
    SCHEMA_ERROR,
    UNSUPPORTED_VERSION,
    INVALID_DATA_SOURCE,
    LOCAL_ACTION_INVALID_STEP,

    // ── type / operation ──
    OPERATION_INVALID_FOR_TYPE,
    OPERATION_MISSING_FIELD,

    // ── action specific ──
    INVALID_STORAGE_OPERATION,
    INVALID_STORAGE_TYPE,
    STORAGE_SET_MISSING_VALUE,
    INVALID_CLIPBOARD_OPERATION,
    CLIPBOARD_WRITE_MISSING_VALUE,
    INVALID_NAVIGATE_TARGET,

    // ── layout ──
    LAYOUT_MISSING_SLOT,
    DUPLICATE_SLOT_NAME,
    DUPLICATE_DEFAULT_SLOT,
    SLOT_IN_LOOP,

    // ── accessibility (reported as warnings) ──
    A11Y_IMG_NO_ALT,
    A11Y_BUTTON_NO_LABEL,
    A11Y_ANCHOR_NO_LABEL,
    A11Y_INPUT_NO_LABEL,
    A11Y_HEADING_SKIP,
    A11Y_POSITIVE_TABINDEX,
    A11Y_DUPLICATE_ID
}
