/**
 * Compiles a {@link works.bosk.jer.descriptor.SchemaDescriptor descriptor model}
 * into {@link works.bosk.jer.mapping.node.TypeNode} trees held in a
 * {@link works.bosk.jer.mapping.SchemaMap}.
 * <p>
 * Compilation happens once per schema; the result is immutable and is
 * reused by every subsequent encode and decode.
 */
package works.bosk.jer.compiler;
