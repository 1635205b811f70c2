/**
 * Abstract datatype describing what a JSON document contains
 * and how it relates to native values.
 * <p>
 * A compiled type is a tree of {@link works.bosk.jer.mapping.node.TypeNode}s,
 * one per occurrence of an ASN.1 type in the schema.
 * Interfaces group the nodes by the shape of their JSON:
 * {@link works.bosk.jer.mapping.node.ScalarNode} for single JSON values,
 * {@link works.bosk.jer.mapping.node.MemberListNode} for JSON objects with named members, and
 * {@link works.bosk.jer.mapping.node.CollectionNode} for JSON arrays.
 * <p>
 * Nodes are immutable, so a compiled tree can be used by any number of threads at once.
 */
package works.bosk.jer.mapping.node;
