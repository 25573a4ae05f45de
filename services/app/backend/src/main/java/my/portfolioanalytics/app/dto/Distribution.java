package my.portfolioanalytics.app.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Schema(description = "Labeled values in report order. An empty result may carry a note explaining why.")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Distribution(
		List<DistributionEntry> entries,
		String note
) {
	public Distribution {
		entries = entries == null ? List.of() : List.copyOf(entries);
	}

	public static Distribution of(List<DistributionEntry> entries) {
		return new Distribution(entries, null);
	}

	public static Distribution empty() {
		return new Distribution(List.of(), null);
	}

	public static Distribution unavailable(String note) {
		return new Distribution(List.of(), note);
	}

	@JsonIgnore
	public boolean isEmpty() {
		return entries.isEmpty();
	}

	public Optional<Double> valueOf(String label) {
		return entries.stream()
				.filter(entry -> Objects.equals(entry.label(), label))
				.map(DistributionEntry::value)
				.findFirst();
	}

	@JsonIgnore
	public List<String> labels() {
		return entries.stream().map(DistributionEntry::label).toList();
	}

	@JsonIgnore
	public double total() {
		return entries.stream()
				.map(DistributionEntry::value)
				.filter(Objects::nonNull)
				.mapToDouble(Double::doubleValue)
				.sum();
	}
}
