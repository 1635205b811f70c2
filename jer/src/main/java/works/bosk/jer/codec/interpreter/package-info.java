/**
 * Encoding and decoding by walking the compiled type nodes at runtime.
 * <p>
 * Each node kind has a fixed mapping between its native Java value and its JSON tree;
 * the {@link works.bosk.jer.codec.interpreter.NodeInterpretingEncoder encoder} and
 * {@link works.bosk.jer.codec.interpreter.NodeInterpretingDecoder decoder} apply
 * these mappings recursively, following {@link works.bosk.jer.mapping.node.TypeRefNode}s
 * through the {@link works.bosk.jer.mapping.SchemaMap SchemaMap}.
 */
package works.bosk.jer.codec.interpreter;
