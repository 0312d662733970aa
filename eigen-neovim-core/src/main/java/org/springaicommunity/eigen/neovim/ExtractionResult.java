package org.springaicommunity.eigen.neovim;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Facts extracted from one config file.
 *
 * @param facts the facts in source order; empty when unparseable
 * @param outcome whether the file parsed
 * @param error the syntax error, for unparseable files
 */
public record ExtractionResult(List<StructuralFact> facts, ParseOutcome outcome, @Nullable String error) {

	public ExtractionResult {
		facts = List.copyOf(facts);
	}

	public static ExtractionResult parsed(List<StructuralFact> facts) {
		return new ExtractionResult(facts, ParseOutcome.PARSED, null);
	}

	public static ExtractionResult unparseable(String error) {
		return new ExtractionResult(List.of(), ParseOutcome.UNPARSEABLE, error);
	}

	public boolean isParsed() {
		return outcome == ParseOutcome.PARSED;
	}

	/**
	 * Facts of one kind, in source order.
	 */
	public <T extends StructuralFact> List<T> factsOf(Class<T> type) {
		return facts.stream().filter(type::isInstance).map(type::cast).toList();
	}

}
