package works.bosk.jer.compiler;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.jer.descriptor.MemberDescriptor;
import works.bosk.jer.exceptions.UnsupportedExtensionException;
import works.bosk.jer.mapping.node.Field;
import works.bosk.jer.mapping.node.TypeNode;

/**
 * Turns the member list of a SEQUENCE, SET or CHOICE into {@link Field}s,
 * in declaration order.
 */
final class MemberCompiler {
	private final SchemaCompiler compiler;

	MemberCompiler(SchemaCompiler compiler) {
		this.compiler = compiler;
	}

	record CompiledMembers(List<Field> fields, boolean extensible) { }

	/**
	 * OPTIONAL and DEFAULT are attached exactly as declared.
	 *
	 * @throws UnsupportedExtensionException if any member follows the extension marker
	 */
	CompiledMembers compileMembers(List<MemberDescriptor> members, String moduleName) {
		List<Field> fields = new ArrayList<>(members.size());
		boolean extensible = false;
		for (MemberDescriptor member : members) {
			if (member.isExtensionMarker()) {
				extensible = true;
				continue;
			}
			if (extensible) {
				throw new UnsupportedExtensionException(member.name());
			}
			LOGGER.trace("Compiling member {}", member.name());
			TypeNode node = compiler.compileType(member.descriptor(), moduleName);
			fields.add(new Field(member.name(), node, member.optional(), member.defaultValue()));
		}
		return new CompiledMembers(fields, extensible);
	}

	/**
	 * Like {@link #compileMembers}, but any OPTIONAL or DEFAULT marking is ignored.
	 */
	CompiledMembers compileAlternatives(List<MemberDescriptor> members, String moduleName) {
		CompiledMembers compiled = compileMembers(members, moduleName);
		List<Field> alternatives = compiled.fields().stream()
			.map(f -> Field.alternative(f.name(), f.node()))
			.toList();
		return new CompiledMembers(alternatives, compiled.extensible());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MemberCompiler.class);
}
