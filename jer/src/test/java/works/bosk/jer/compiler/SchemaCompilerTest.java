package works.bosk.jer.compiler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import works.bosk.jer.descriptor.BuiltinKind;
import works.bosk.jer.descriptor.ImportingTypeResolver;
import works.bosk.jer.descriptor.ModuleDescriptor;
import works.bosk.jer.descriptor.SchemaDescriptor;
import works.bosk.jer.descriptor.SizeConstraintExtractor;
import works.bosk.jer.descriptor.SizeRange;
import works.bosk.jer.descriptor.TypeDescriptor;
import works.bosk.jer.exceptions.SchemaException;
import works.bosk.jer.exceptions.UnresolvedTypeException;
import works.bosk.jer.exceptions.UnsupportedExtensionException;
import works.bosk.jer.mapping.SchemaMap;
import works.bosk.jer.mapping.TypeName;
import works.bosk.jer.mapping.node.AnyNode;
import works.bosk.jer.mapping.node.BooleanNode;
import works.bosk.jer.mapping.node.CharacterStringNode;
import works.bosk.jer.mapping.node.CharacterStringType;
import works.bosk.jer.mapping.node.ChoiceNode;
import works.bosk.jer.mapping.node.EnumeratedNode;
import works.bosk.jer.mapping.node.Field;
import works.bosk.jer.mapping.node.IntegerNode;
import works.bosk.jer.mapping.node.NullNode;
import works.bosk.jer.mapping.node.ObjectIdentifierNode;
import works.bosk.jer.mapping.node.OctetStringNode;
import works.bosk.jer.mapping.node.RealNode;
import works.bosk.jer.mapping.node.SequenceNode;
import works.bosk.jer.mapping.node.SequenceOfNode;
import works.bosk.jer.mapping.node.SetNode;
import works.bosk.jer.mapping.node.SetOfNode;
import works.bosk.jer.mapping.node.TypeNode;
import works.bosk.jer.mapping.node.TypeRefNode;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.bosk.jer.TestSchemas.MODULE;
import static works.bosk.jer.TestSchemas.bool;
import static works.bosk.jer.TestSchemas.compile;
import static works.bosk.jer.TestSchemas.integer;
import static works.bosk.jer.TestSchemas.node;
import static works.bosk.jer.TestSchemas.schema;
import static works.bosk.jer.TestSchemas.utf8;
import static works.bosk.jer.descriptor.MemberDescriptor.extensionMarker;
import static works.bosk.jer.descriptor.MemberDescriptor.optional;
import static works.bosk.jer.descriptor.MemberDescriptor.required;
import static works.bosk.jer.descriptor.MemberDescriptor.withDefault;
import static works.bosk.jer.descriptor.TypeDescriptor.choice;
import static works.bosk.jer.descriptor.TypeDescriptor.reference;
import static works.bosk.jer.descriptor.TypeDescriptor.sequence;
import static works.bosk.jer.descriptor.TypeDescriptor.sequenceOf;

class SchemaCompilerTest {

	@Test
	void scalars() {
		SchemaMap map = compile(
			"I", integer(),
			"R", TypeDescriptor.of(BuiltinKind.REAL),
			"B", bool(),
			"N", TypeDescriptor.of(BuiltinKind.NULL),
			"O", TypeDescriptor.of(BuiltinKind.OBJECT_IDENTIFIER),
			"A", TypeDescriptor.of(BuiltinKind.ANY_DEFINED_BY));
		assertInstanceOf(IntegerNode.class, node(map, "I"));
		assertInstanceOf(RealNode.class, node(map, "R"));
		assertInstanceOf(BooleanNode.class, node(map, "B"));
		assertInstanceOf(NullNode.class, node(map, "N"));
		assertInstanceOf(ObjectIdentifierNode.class, node(map, "O"));
		assertInstanceOf(AnyNode.class, node(map, "A"));
	}

	@ParameterizedTest
	@EnumSource(CharacterStringType.class)
	void characterStrings(CharacterStringType type) {
		SchemaMap map = compile("S", TypeDescriptor.of(type.kind()));
		assertEquals(new CharacterStringNode(type), node(map, "S"));
	}

	@Test
	void enumerated() {
		Map<Long, String> values = new LinkedHashMap<>();
		values.put(0L, "red");
		values.put(5L, "green");
		SchemaMap map = compile("Color", TypeDescriptor.enumerated(values));
		EnumeratedNode color = assertInstanceOf(EnumeratedNode.class, node(map, "Color"));
		assertEquals(List.of("red", "green"), color.names());
		assertEquals(Optional.of(5L), color.ordinalOf("green"));
		assertEquals(Optional.of("red"), color.nameOf(0));
	}

	@Test
	void duplicateEnumerationIdentifier_throws() {
		Map<Long, String> values = new LinkedHashMap<>();
		values.put(0L, "red");
		values.put(1L, "red");
		assertThrows(SchemaException.class, () -> compile("Color", TypeDescriptor.enumerated(values)));
	}

	@Test
	void membersKeepDeclarationOrderAndModifiers() {
		SchemaMap map = compile("S", sequence(
			required("a", integer()),
			optional("b", utf8()),
			withDefault("c", bool(), true)));
		SequenceNode s = assertInstanceOf(SequenceNode.class, node(map, "S"));
		assertEquals(List.of("a", "b", "c"), s.fieldNames());
		assertFalse(s.extensible());

		Field a = s.fields().get(0);
		Field b = s.fields().get(1);
		Field c = s.fields().get(2);
		assertTrue(a.isRequired());
		assertTrue(b.optional());
		assertEquals(true, c.defaultValue());
		assertFalse(c.isRequired());
	}

	@Test
	void fieldDefaultIsCopiedOnEachRead() {
		byte[] declared = { 7 };
		SchemaMap map = compile("S", sequence(withDefault("d", TypeDescriptor.octetString(), declared)));
		Field d = assertInstanceOf(SequenceNode.class, node(map, "S")).fields().get(0);
		declared[0] = 8;
		byte[] first = (byte[]) d.defaultValue();
		assertNotSame(first, d.defaultValue());
		first[0] = 9;
		assertArrayEquals(new byte[]{ 7 }, (byte[]) d.defaultValue());
	}

	@Test
	void setCompilesLikeSequence() {
		SchemaMap map = compile("S", TypeDescriptor.set(required("x", integer())));
		SetNode s = assertInstanceOf(SetNode.class, node(map, "S"));
		assertEquals(List.of("x"), s.fieldNames());
	}

	@Test
	void extensionMarker_setsExtensible() {
		SchemaMap map = compile(
			"S", sequence(required("a", integer()), extensionMarker()),
			"C", choice(required("x", integer()), extensionMarker()));
		SequenceNode s = assertInstanceOf(SequenceNode.class, node(map, "S"));
		assertTrue(s.extensible());
		assertEquals(List.of("a"), s.fieldNames());
		assertTrue(assertInstanceOf(ChoiceNode.class, node(map, "C")).extensible());
	}

	@Test
	void memberAfterExtensionMarker_throws() {
		var e = assertThrows(UnsupportedExtensionException.class, () -> compile("S", sequence(
			required("a", integer()),
			extensionMarker(),
			required("b", integer()))));
		assertEquals("b", e.memberName());
	}

	@Test
	void choiceIgnoresOptionalAndDefault() {
		SchemaMap map = compile("C", choice(
			optional("a", integer()),
			withDefault("b", bool(), false)));
		ChoiceNode c = assertInstanceOf(ChoiceNode.class, node(map, "C"));
		for (Field f : c.fields()) {
			assertFalse(f.optional(), f.name());
			assertFalse(f.hasDefault(), f.name());
		}
	}

	@Test
	void duplicateMemberName_throws() {
		assertThrows(SchemaException.class, () -> compile("S", sequence(
			required("a", integer()),
			required("a", bool()))));
	}

	@Test
	void sizeConstraintsAreRetained() {
		SchemaMap map = compile(
			"O", TypeDescriptor.octetString().withSize(SizeRange.fixed(4)),
			"L", sequenceOf(integer()).withSize(SizeRange.of(1, 10)));
		assertEquals(SizeRange.fixed(4), ((OctetStringNode) node(map, "O")).size());
		SequenceOfNode list = assertInstanceOf(SequenceOfNode.class, node(map, "L"));
		assertEquals(SizeRange.of(1, 10), list.size());
		assertInstanceOf(IntegerNode.class, list.element());
	}

	@Test
	void unconstrainedSize() {
		SchemaMap map = compile("L", TypeDescriptor.setOf(utf8()));
		assertEquals(SizeRange.UNCONSTRAINED, assertInstanceOf(SetOfNode.class, node(map, "L")).size());
	}

	@Test
	void sequenceOfWithoutElement_throws() {
		TypeDescriptor broken = new TypeDescriptor("SEQUENCE OF", List.of(), null, Map.of(), null);
		assertThrows(SchemaException.class, () -> compile("L", broken));
	}

	@Test
	void unresolvedReference_throws() {
		var e = assertThrows(UnresolvedTypeException.class, () -> compile("S", sequence(required("x", reference("Missing")))));
		assertEquals("Missing", e.typeName());
		assertEquals(MODULE, e.moduleName());
	}

	@Test
	void namedTypesAreSharedByReference() {
		SchemaMap map = compile(
			"Pair", sequence(required("first", reference("Name")), required("second", reference("Name"))),
			"Name", utf8());
		SequenceNode pair = (SequenceNode) node(map, "Pair");
		TypeRefNode first = assertInstanceOf(TypeRefNode.class, pair.fields().get(0).node());
		TypeRefNode second = assertInstanceOf(TypeRefNode.class, pair.fields().get(1).node());
		assertEquals(new TypeName(MODULE, "Name"), first.target());
		assertEquals(first, second);
		assertSame(node(map, "Name"), map.get(first.target()));
	}

	@Test
	void recursiveType() {
		SchemaMap map = compile("List", sequence(
			required("value", integer()),
			optional("next", reference("List"))));
		SequenceNode list = assertInstanceOf(SequenceNode.class, node(map, "List"));
		TypeRefNode next = assertInstanceOf(TypeRefNode.class, list.fields().get(1).node());
		assertSame(list, map.get(next.target()));
	}

	@Test
	void mutuallyRecursiveTypes() {
		SchemaMap map = compile(
			"Tree", sequence(required("children", reference("Forest"))),
			"Forest", sequenceOf(reference("Tree")));
		SequenceOfNode forest = assertInstanceOf(SequenceOfNode.class, node(map, "Forest"));
		assertEquals(new TypeRefNode(new TypeName(MODULE, "Tree")), forest.element());
	}

	@Test
	void aliasResolvesToTarget() {
		SchemaMap map = compile(
			"Age", reference("Count"),
			"Count", integer());
		assertEquals(new TypeRefNode(new TypeName(MODULE, "Count")), node(map, "Age"));
	}

	@Test
	void selfAlias_throws() {
		assertThrows(SchemaException.class, () -> compile("A", reference("A")));
	}

	@Test
	void aliasCycle_throws() {
		assertThrows(SchemaException.class, () -> compile(
			"A", reference("B"),
			"B", reference("A")));
	}

	@Test
	void importedTypesResolveToTheirOwnModule() {
		SchemaDescriptor schema = new SchemaDescriptor(Map.of(
			"Main", new ModuleDescriptor(
				Map.of("Person", sequence(required("name", reference("Name")))),
				Map.of("Common", List.of("Name"))),
			"Common", ModuleDescriptor.of(Map.of("Name", utf8()))));
		SchemaMap map = SchemaCompiler.compileSchema(schema);
		SequenceNode person = (SequenceNode) map.get(new TypeName("Main", "Person"));
		assertEquals(new TypeRefNode(new TypeName("Common", "Name")), person.fields().get(0).node());
		assertFalse(map.contains(new TypeName("Main", "Name")));
	}

	@Test
	void quarantine_keepsGoodTypes() {
		SchemaMap map = SchemaCompiler.compileSchema(schema(
			"Good", integer(),
			"Bad", sequence(required("x", reference("Missing"))),
			"UsesBad", sequence(required("bad", reference("Bad")))),
			CompilerSettings.QUARANTINE);
		assertTrue(map.isFrozen());
		assertEquals(List.of(new TypeName(MODULE, "Good")), List.copyOf(map.knownTypes()));
		assertEquals(
			List.of(new TypeName(MODULE, "Bad"), new TypeName(MODULE, "UsesBad")),
			List.copyOf(map.quarantined().keySet()));
		assertInstanceOf(UnresolvedTypeException.class, map.quarantined().get(new TypeName(MODULE, "Bad")));
	}

	@Test
	void quarantine_removesTypesLeftDangling() {
		SchemaMap map = SchemaCompiler.compileSchema(schema(
			"A", reference("B"),
			"B", reference("A"),
			"C", bool()),
			CompilerSettings.QUARANTINE);
		assertEquals(List.of(new TypeName(MODULE, "C")), List.copyOf(map.knownTypes()));
		assertTrue(map.quarantined().containsKey(new TypeName(MODULE, "A")));
		assertTrue(map.quarantined().containsKey(new TypeName(MODULE, "B")));
	}

	@Test
	void compileOneType() {
		SchemaDescriptor schema = schema("Id", integer());
		var compiler = new SchemaCompiler(
			new ImportingTypeResolver(schema),
			SizeConstraintExtractor.declared(),
			CompilerSettings.DEFAULT);
		TypeNode node = compiler.compile(MODULE, "Holder", sequence(required("id", reference("Id"))));
		SchemaMap map = compiler.finish();
		assertSame(node, map.get(new TypeName(MODULE, "Holder")));
		assertTrue(map.contains(new TypeName(MODULE, "Id")));
		assertThrows(IllegalStateException.class, () -> map.put(new TypeName(MODULE, "X"), new IntegerNode()));
	}

	@Test
	void customSizeExtractor() {
		SchemaDescriptor schema = schema("O", TypeDescriptor.octetString());
		var compiler = new SchemaCompiler(
			new ImportingTypeResolver(schema),
			(descriptor, moduleName) -> SizeRange.fixed(16),
			CompilerSettings.DEFAULT);
		OctetStringNode node = (OctetStringNode) compiler.compile(MODULE, "O", schema.module(MODULE).types().get("O"));
		assertEquals(SizeRange.fixed(16), node.size());
	}
}
