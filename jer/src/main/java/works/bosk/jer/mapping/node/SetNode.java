package works.bosk.jer.mapping.node;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * SET, represented as a JSON object with one member per field present.
 * Member order is not significant, though encoding still emits members in declaration order.
 */
public record SetNode(
	List<Field> fields,
	boolean extensible
) implements MemberListNode {
	public SetNode {
		fields = List.copyOf(fields);
		Set<String> names = new HashSet<>();
		for (Field field : fields) {
			if (!names.add(field.name())) {
				throw new IllegalArgumentException("Duplicate SET member '" + field.name() + "'");
			}
		}
	}

	@Override
	public String briefIdentifier() {
		return "SET";
	}

	@Override
	public <A, R> R accept(Visitor<A, R> visitor, A argument) {
		return visitor.visitSet(this, argument);
	}

	@Override
	public String toString() {
		return fields.stream()
			.map(Field::toString)
			.collect(Collectors.joining(", ", "SET { ", extensible ? ", ... }" : " }"));
	}
}
