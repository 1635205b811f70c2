/**
 * The compiled form of a schema.
 * <p>
 * The {@link works.bosk.jer.mapping.node node package} has the
 * {@link works.bosk.jer.mapping.node.TypeNode TypeNode} hierarchy describing
 * how each ASN.1 type corresponds to JSON, and the {@link works.bosk.jer.mapping.SchemaMap}
 * holds the node for every named type so that
 * {@link works.bosk.jer.mapping.node.TypeRefNode TypeRefNode}s can be resolved.
 */
package works.bosk.jer.mapping;
