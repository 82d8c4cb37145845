package org.conflux.runtime.api;

/**
 * Categories of failures the conversion engine distinguishes.
 */
public enum ConversionErrorKind {
    RECIPE_NOT_FOUND,
    CONVERTER_NOT_FOUND_OR_INVALID,
    CONVERTER_AT_CAPACITY,
    NO_CONVERTERS_AVAILABLE,
    INSUFFICIENT_RESOURCES,
    CONSUME_FAILURE,
    TRANSFER_FAILURE,
    NODE_UPDATE_FAILURE,
    DIRECTORY_UNAVAILABLE
}
