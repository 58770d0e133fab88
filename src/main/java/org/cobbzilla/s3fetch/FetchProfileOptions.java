package org.cobbzilla.s3fetch;

/**
 * Endpoint quirks that can be switched on per profile with the "options" line in .s3cfg.
 */
public enum FetchProfileOptions {
    PATH_STYLE_ACCESS,
    NO_ENCODING_TYPE
}
