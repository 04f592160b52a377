package com.gatediscovery.engine.entity;

/**
 * How a gate came to exist: discovered from scan clusters, or entered by an operator.
 */
public enum DerivationMethod {
    CLUSTERING,
    MANUAL
}
