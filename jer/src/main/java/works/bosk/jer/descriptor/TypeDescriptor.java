package works.bosk.jer.descriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import works.bosk.jer.mapping.Nullable;

import static java.util.Objects.requireNonNull;
import static works.bosk.jer.descriptor.BuiltinKind.BIT_STRING;
import static works.bosk.jer.descriptor.BuiltinKind.CHOICE;
import static works.bosk.jer.descriptor.BuiltinKind.ENUMERATED;
import static works.bosk.jer.descriptor.BuiltinKind.OCTET_STRING;
import static works.bosk.jer.descriptor.BuiltinKind.SEQUENCE;
import static works.bosk.jer.descriptor.BuiltinKind.SEQUENCE_OF;
import static works.bosk.jer.descriptor.BuiltinKind.SET;
import static works.bosk.jer.descriptor.BuiltinKind.SET_OF;

/**
 * The parsed form of one ASN.1 type, as produced by the schema front end.
 * <p>
 * If {@link #kind} is not a {@link BuiltinKind} keyword, the descriptor is a reference
 * to the type of that name, to be resolved in the owning module and its imports.
 *
 * @param members for SEQUENCE, SET and CHOICE; empty otherwise
 * @param element for SEQUENCE OF and SET OF
 * @param values for ENUMERATED: ordinal to identifier, in declaration order
 * @param size declared SIZE constraint, if any
 */
public record TypeDescriptor(
	String kind,
	List<MemberDescriptor> members,
	@Nullable TypeDescriptor element,
	Map<Long, String> values,
	@Nullable SizeRange size
) {
	public TypeDescriptor {
		requireNonNull(kind);
		members = List.copyOf(members);
		values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
	}

	public static TypeDescriptor of(BuiltinKind kind) {
		return new TypeDescriptor(kind.keyword(), List.of(), null, Map.of(), null);
	}

	public static TypeDescriptor reference(String typeName) {
		if (BuiltinKind.forKeyword(typeName).isPresent()) {
			throw new IllegalArgumentException("'" + typeName + "' is a built-in type, not a reference");
		}
		return new TypeDescriptor(typeName, List.of(), null, Map.of(), null);
	}

	public static TypeDescriptor sequence(MemberDescriptor... members) {
		return new TypeDescriptor(SEQUENCE.keyword(), List.of(members), null, Map.of(), null);
	}

	public static TypeDescriptor set(MemberDescriptor... members) {
		return new TypeDescriptor(SET.keyword(), List.of(members), null, Map.of(), null);
	}

	public static TypeDescriptor choice(MemberDescriptor... members) {
		return new TypeDescriptor(CHOICE.keyword(), List.of(members), null, Map.of(), null);
	}

	public static TypeDescriptor sequenceOf(TypeDescriptor element) {
		return new TypeDescriptor(SEQUENCE_OF.keyword(), List.of(), requireNonNull(element), Map.of(), null);
	}

	public static TypeDescriptor setOf(TypeDescriptor element) {
		return new TypeDescriptor(SET_OF.keyword(), List.of(), requireNonNull(element), Map.of(), null);
	}

	public static TypeDescriptor bitString() {
		return of(BIT_STRING);
	}

	public static TypeDescriptor octetString() {
		return of(OCTET_STRING);
	}

	/**
	 * @param values ordinal to identifier; iteration order is kept
	 */
	public static TypeDescriptor enumerated(Map<Long, String> values) {
		return new TypeDescriptor(ENUMERATED.keyword(), List.of(), null, values, null);
	}

	public TypeDescriptor withSize(SizeRange size) {
		return new TypeDescriptor(kind, members, element, values, requireNonNull(size));
	}

	/**
	 * @return the built-in kind, or empty if this is a named-type reference
	 */
	public Optional<BuiltinKind> builtinKind() {
		return BuiltinKind.forKeyword(kind);
	}
}
