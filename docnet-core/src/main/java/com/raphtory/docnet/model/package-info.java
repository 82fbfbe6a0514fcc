/**
 * Entities held by a DocNet store and their extension points.
 *<p>
 * {@link com.raphtory.docnet.model.Vertex} - a document with a place.
 *<p>
 * {@link com.raphtory.docnet.model.Edge} - a labelled, optionally directed link between two vertices.
 *<p>
 * {@link com.raphtory.docnet.model.AnchoredEdge} - an edge seen from one of its ends.
 *<p>
 * {@link com.raphtory.docnet.model.VertexFactory} and {@link com.raphtory.docnet.model.EdgeFactory} -
 * used to rebuild application-defined subclasses from a snapshot.
 */
package com.raphtory.docnet.model;
