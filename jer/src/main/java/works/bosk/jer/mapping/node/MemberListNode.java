package works.bosk.jer.mapping.node;

import java.util.List;

/**
 * A type made of named members, represented as a JSON object.
 */
public sealed interface MemberListNode extends TypeNode permits
	SequenceNode,
	SetNode,
	ChoiceNode
{
	/**
	 * @return the members in declaration order
	 */
	List<Field> fields();

	/**
	 * @return true if the type declared an extension marker
	 */
	boolean extensible();

	default List<String> fieldNames() {
		return fields().stream().map(Field::name).toList();
	}
}
