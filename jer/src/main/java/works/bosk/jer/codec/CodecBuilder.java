package works.bosk.jer.codec;

import works.bosk.jer.codec.interpreter.NodeInterpretingDecoder;
import works.bosk.jer.codec.interpreter.NodeInterpretingEncoder;
import works.bosk.jer.mapping.SchemaMap;
import works.bosk.jer.mapping.node.TypeNode;

import static java.util.Objects.requireNonNull;

/**
 * Builds a {@link Codec} according to the user's instructions.
 */
public class CodecBuilder {
	private final SchemaMap schemaMap;
	private CodecSettings settings = CodecSettings.DEFAULT;

	private CodecBuilder(SchemaMap schemaMap) {
		this.schemaMap = schemaMap;
	}

	/**
	 * @param schemaMap is used to resolve any {@link works.bosk.jer.mapping.node.TypeRefNode}s.
	 *                  It must be {@link SchemaMap#freeze() frozen}.
	 */
	public static CodecBuilder using(SchemaMap schemaMap) {
		if (!schemaMap.isFrozen()) {
			throw new IllegalArgumentException("SchemaMap must be frozen before building a codec");
		}
		return new CodecBuilder(schemaMap);
	}

	public CodecBuilder withSettings(CodecSettings settings) {
		this.settings = requireNonNull(settings);
		return this;
	}

	public Codec build() {
		SchemaMap schemaMap = this.schemaMap;
		CodecSettings settings = this.settings;
		return new Codec() {
			@Override
			public Encoder encoderFor(TypeNode node) {
				return new NodeInterpretingEncoder(node, schemaMap, settings);
			}

			@Override
			public Decoder decoderFor(TypeNode node) {
				return new NodeInterpretingDecoder(node, schemaMap, settings);
			}
		};
	}
}
