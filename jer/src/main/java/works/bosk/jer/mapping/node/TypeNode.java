package works.bosk.jer.mapping.node;

/**
 * A node in the compiled type tree, describing how one occurrence of an ASN.1 type
 * corresponds to its JSON representation.
 * <p>
 * Nodes are immutable and own their children, except that a named type is
 * represented by a {@link TypeRefNode} to be looked up in a
 * {@link works.bosk.jer.mapping.SchemaMap SchemaMap}.
 * <p>
 * Code that processes nodes does so through a {@link Visitor},
 * so that adding a new kind of node is a compile error until every processor handles it.
 */
public sealed interface TypeNode permits
	ScalarNode,
	MemberListNode,
	CollectionNode,
	AnyNode,
	TypeRefNode
{
	/**
	 * @return a short name for the node's ASN.1 type, suitable for error messages
	 */
	String briefIdentifier();

	<A, R> R accept(Visitor<A, R> visitor, A argument);

	/**
	 * One method per concrete node type.
	 *
	 * @param <A> an argument passed through from {@link #accept}
	 * @param <R> the result type
	 */
	interface Visitor<A, R> {
		R visitInteger(IntegerNode node, A argument);
		R visitReal(RealNode node, A argument);
		R visitBoolean(BooleanNode node, A argument);
		R visitNull(NullNode node, A argument);
		R visitEnumerated(EnumeratedNode node, A argument);
		R visitCharacterString(CharacterStringNode node, A argument);
		R visitBitString(BitStringNode node, A argument);
		R visitOctetString(OctetStringNode node, A argument);
		R visitObjectIdentifier(ObjectIdentifierNode node, A argument);
		R visitSequence(SequenceNode node, A argument);
		R visitSet(SetNode node, A argument);
		R visitChoice(ChoiceNode node, A argument);
		R visitSequenceOf(SequenceOfNode node, A argument);
		R visitSetOf(SetOfNode node, A argument);
		R visitAny(AnyNode node, A argument);
		R visitTypeRef(TypeRefNode node, A argument);
	}
}
