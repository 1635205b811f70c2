package works.bosk.jer.mapping.node;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * SEQUENCE, represented as a JSON object with one member per field present.
 * The JSON object's members follow declaration order.
 */
public record SequenceNode(
	List<Field> fields,
	boolean extensible
) implements MemberListNode {
	public SequenceNode {
		fields = List.copyOf(fields);
		Set<String> names = new HashSet<>();
		for (Field field : fields) {
			if (!names.add(field.name())) {
				throw new IllegalArgumentException("Duplicate SEQUENCE member '" + field.name() + "'");
			}
		}
	}

	@Override
	public String briefIdentifier() {
		return "SEQUENCE";
	}

	@Override
	public <A, R> R accept(Visitor<A, R> visitor, A argument) {
		return visitor.visitSequence(this, argument);
	}

	@Override
	public String toString() {
		return fields.stream()
			.map(Field::toString)
			.collect(Collectors.joining(", ", "SEQUENCE { ", extensible ? ", ... }" : " }"));
	}
}
