package works.bosk.jer.compiler;

import java.util.Set;
import works.bosk.jer.mapping.TypeName;
import works.bosk.jer.mapping.node.AnyNode;
import works.bosk.jer.mapping.node.BitStringNode;
import works.bosk.jer.mapping.node.BooleanNode;
import works.bosk.jer.mapping.node.CharacterStringNode;
import works.bosk.jer.mapping.node.ChoiceNode;
import works.bosk.jer.mapping.node.EnumeratedNode;
import works.bosk.jer.mapping.node.Field;
import works.bosk.jer.mapping.node.IntegerNode;
import works.bosk.jer.mapping.node.MemberListNode;
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

/**
 * Adds the target of every {@link TypeRefNode} in a tree to the given set,
 * without following the references themselves.
 */
final class ReferenceCollector implements TypeNode.Visitor<Set<TypeName>, Void> {
	static final ReferenceCollector INSTANCE = new ReferenceCollector();

	private ReferenceCollector() { }

	@Override public Void visitInteger(IntegerNode node, Set<TypeName> refs) { return null; }
	@Override public Void visitReal(RealNode node, Set<TypeName> refs) { return null; }
	@Override public Void visitBoolean(BooleanNode node, Set<TypeName> refs) { return null; }
	@Override public Void visitNull(NullNode node, Set<TypeName> refs) { return null; }
	@Override public Void visitEnumerated(EnumeratedNode node, Set<TypeName> refs) { return null; }
	@Override public Void visitCharacterString(CharacterStringNode node, Set<TypeName> refs) { return null; }
	@Override public Void visitBitString(BitStringNode node, Set<TypeName> refs) { return null; }
	@Override public Void visitOctetString(OctetStringNode node, Set<TypeName> refs) { return null; }
	@Override public Void visitObjectIdentifier(ObjectIdentifierNode node, Set<TypeName> refs) { return null; }
	@Override public Void visitAny(AnyNode node, Set<TypeName> refs) { return null; }

	@Override
	public Void visitSequence(SequenceNode node, Set<TypeName> refs) {
		return visitMembers(node, refs);
	}

	@Override
	public Void visitSet(SetNode node, Set<TypeName> refs) {
		return visitMembers(node, refs);
	}

	@Override
	public Void visitChoice(ChoiceNode node, Set<TypeName> refs) {
		return visitMembers(node, refs);
	}

	@Override
	public Void visitSequenceOf(SequenceOfNode node, Set<TypeName> refs) {
		return node.element().accept(this, refs);
	}

	@Override
	public Void visitSetOf(SetOfNode node, Set<TypeName> refs) {
		return node.element().accept(this, refs);
	}

	@Override
	public Void visitTypeRef(TypeRefNode node, Set<TypeName> refs) {
		refs.add(node.target());
		return null;
	}

	private Void visitMembers(MemberListNode node, Set<TypeName> refs) {
		for (Field field : node.fields()) {
			field.node().accept(this, refs);
		}
		return null;
	}
}
