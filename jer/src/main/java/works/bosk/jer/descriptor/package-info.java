/**
 * The Descriptor Model: ASN.1 type definitions as parsed by a schema front end,
 * before compilation.
 * <p>
 * Also defines the two collaborators the {@link works.bosk.jer.compiler.SchemaCompiler}
 * relies on: a {@link works.bosk.jer.descriptor.TypeResolver} for named-type references
 * and a {@link works.bosk.jer.descriptor.SizeConstraintExtractor} for SIZE bounds.
 */
package works.bosk.jer.descriptor;
