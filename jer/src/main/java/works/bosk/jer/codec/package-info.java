/**
 * Turning compiled type nodes into working encoders and decoders.
 * <p>
 * Most callers need only {@link works.bosk.jer.codec.CompiledSchema#compile}
 * followed by {@link works.bosk.jer.codec.CompiledType#encode} and
 * {@link works.bosk.jer.codec.CompiledType#decode}.
 * {@link works.bosk.jer.codec.CodecBuilder} gives access to the intermediate
 * {@link tools.jackson.databind.JsonNode} trees, for callers that compile
 * their own {@link works.bosk.jer.mapping.SchemaMap}.
 */
package works.bosk.jer.codec;
