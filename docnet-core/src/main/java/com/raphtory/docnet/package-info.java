/**
 * DocNet - an embedded document and graph store.
 *<p>
 * This package holds the exception hierarchy shared by the model and implementation layers.
 * All exceptions are unchecked and extend {@link com.raphtory.docnet.DocNetException}.
 *<p>
 * {@link com.raphtory.docnet.model} - vertices, edges and their extension points.
 *<p>
 * {@link com.raphtory.docnet.implementation} - the store, its iterators and the snapshot codec.
 */
package com.raphtory.docnet;
