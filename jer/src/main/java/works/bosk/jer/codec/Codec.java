package works.bosk.jer.codec;

import works.bosk.jer.mapping.node.TypeNode;

/**
 * A factory for {@link Encoder}s and {@link Decoder}s.
 * Accessible via {@link CodecBuilder}.
 * <p>
 * The {@code node} passed to {@link #encoderFor} and {@link #decoderFor}
 * may contain {@link works.bosk.jer.mapping.node.TypeRefNode TypeRefNode}s,
 * which are resolved against the {@link works.bosk.jer.mapping.SchemaMap SchemaMap}
 * used to build this {@code Codec}.
 */
public interface Codec {
	Encoder encoderFor(TypeNode node);
	Decoder decoderFor(TypeNode node);
}
