package works.bosk.jer.mapping.node;

import works.bosk.jer.descriptor.SizeRange;

/**
 * A homogeneous collection, represented as a JSON array
 * whose elements are in the same order as the native value's.
 */
public sealed interface CollectionNode extends TypeNode permits
	SequenceOfNode,
	SetOfNode
{
	TypeNode element();

	/**
	 * Retained for binary encoding rules; the JSON representation doesn't use it.
	 */
	SizeRange size();
}
