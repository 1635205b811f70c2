package works.bosk.jer.mapping.node;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * CHOICE, represented as a JSON object with exactly one member:
 * the chosen alternative.
 */
public record ChoiceNode(
	List<Field> fields,
	boolean extensible
) implements MemberListNode {
	public ChoiceNode {
		fields = List.copyOf(fields);
		for (Field field : fields) {
			if (field.optional() || field.hasDefault()) {
				throw new IllegalArgumentException("CHOICE alternative '" + field.name() + "' can't be OPTIONAL or DEFAULT");
			}
		}
	}

	/**
	 * @return the first alternative with the given name
	 */
	public Optional<Field> alternative(String name) {
		return fields.stream()
			.filter(f -> f.name().equals(name))
			.findFirst();
	}

	@Override
	public String briefIdentifier() {
		return "CHOICE";
	}

	@Override
	public <A, R> R accept(Visitor<A, R> visitor, A argument) {
		return visitor.visitChoice(this, argument);
	}

	@Override
	public String toString() {
		return fields.stream()
			.map(Field::toString)
			.collect(Collectors.joining(", ", "CHOICE { ", extensible ? ", ... }" : " }"));
	}
}
