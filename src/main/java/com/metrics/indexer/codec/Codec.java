package com.metrics.indexer.codec;

/**
 * Reversible transform between an in-process representation and a stored one.
 *
 * @param <D> decoded type
 * @param <E> encoded type
 */
public interface Codec<D, E> {

    E encode(D value);

    D decode(E value);
}
