package com.siteguard.infrastructure.security;

/**
 * Kind of caller, as asserted by the upstream identity gateway.
 */
public enum PrincipalType {
    /** A site credential: may only act on its own site. */
    SITE,
    /** A human user: may act on sites of the organizations they belong to. */
    USER,
    /** The authoritative release feed: may act on every site and publish catalog data. */
    CATALOG_FEED
}
