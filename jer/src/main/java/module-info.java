/**
 * ASN.1 JSON Encoding Rules (JER, ITU-T X.697) for schemas described at runtime.
 * <p>
 * A schema is given as a {@link works.bosk.jer.descriptor descriptor} tree,
 * compiled into {@link works.bosk.jer.mapping.node type nodes} by the
 * {@link works.bosk.jer.compiler.SchemaCompiler SchemaCompiler},
 * and then used to convert native Java values to and from compact JSON text.
 * <p>
 * The major packages are:
 *
 * <ul>
 *     <li>
 *         {@link works.bosk.jer.descriptor}, the input to the compiler;
 *     </li>
 *     <li>
 *         {@link works.bosk.jer.mapping} and {@link works.bosk.jer.mapping.node},
 *         the compiled form, including recursive types; and
 *     </li>
 *     <li>
 *         {@link works.bosk.jer.codec},
 *         which performs the actual encoding and decoding.
 *     </li>
 * </ul>
 */
module works.bosk.jer {
	requires org.slf4j;
	requires transitive tools.jackson.core;
	requires transitive tools.jackson.databind;

	exports works.bosk.jer;
	exports works.bosk.jer.codec;
	exports works.bosk.jer.codec.interpreter;
	exports works.bosk.jer.codec.io;
	exports works.bosk.jer.compiler;
	exports works.bosk.jer.descriptor;
	exports works.bosk.jer.exceptions;
	exports works.bosk.jer.mapping;
	exports works.bosk.jer.mapping.node;
}
