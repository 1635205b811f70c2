package works.bosk.jer.mapping.node;

/**
 * A type with no nested type nodes.
 */
public sealed interface ScalarNode extends TypeNode permits
	IntegerNode,
	RealNode,
	BooleanNode,
	NullNode,
	EnumeratedNode,
	CharacterStringNode,
	BitStringNode,
	OctetStringNode,
	ObjectIdentifierNode
{
}
