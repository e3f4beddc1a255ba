/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpserver.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class CapabilitySetTests {

	@Test
	void getSetAndHasAddressSlotsAndVendorCapabilities() {
		CapabilitySet capabilities = new CapabilitySet();
		capabilities.set("tools", Map.of("listChanged", true));
		capabilities.set("acme", Map.of("turbo", 1));

		assertThat(capabilities.has("tools")).isTrue();
		assertThat(capabilities.has("prompts")).isFalse();
		assertThat(capabilities.get("tools")).isEqualTo(Map.of("listChanged", true));
		assertThat(capabilities.get("acme")).isEqualTo(Map.of("turbo", 1));
		assertThat(capabilities.get("missing")).isNull();
	}

	@Test
	void wellKnownSlotRejectsScalar() {
		CapabilitySet capabilities = new CapabilitySet();
		assertThatThrownBy(() -> capabilities.set("logging", true)).isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("logging");
		assertThat(capabilities.has("logging")).isFalse();
	}

	@Test
	void vendorCapabilityMayBeScalar() {
		CapabilitySet capabilities = new CapabilitySet();
		capabilities.set("beta", true);
		assertThat(capabilities.get("beta")).isEqualTo(true);
	}

	@Test
	void setNullAndRemoveClear() {
		CapabilitySet capabilities = CapabilitySet.builder().tools(true).capability("acme", Map.of()).build();

		capabilities.set("tools", null);
		assertThat(capabilities.has("tools")).isFalse();
		assertThat(capabilities.remove("acme")).isTrue();
		assertThat(capabilities.remove("acme")).isFalse();
		assertThat(capabilities.isEmpty()).isTrue();
	}

	@Test
	void toMapRendersPresentSlotsInFixedOrderThenVendorEntries() {
		CapabilitySet capabilities = new CapabilitySet();
		capabilities.set("acme", Map.of());
		capabilities.set("tools", Map.of("listChanged", true));
		capabilities.set("logging", Map.of());

		assertThat(capabilities.toMap()).containsExactly(Map.entry("logging", Map.of()),
				Map.entry("tools", Map.of("listChanged", true)), Map.entry("acme", Map.of()));
	}

	@Test
	void mergeUnionsSlotSubOptions() {
		CapabilitySet left = CapabilitySet.fromMap(Map.of("tools", Map.of("listChanged", true)));
		CapabilitySet right = CapabilitySet.fromMap(Map.of("tools", Map.of("subscribe", true)));

		assertThat(left.merge(right).toMap())
			.isEqualTo(Map.of("tools", Map.of("listChanged", true, "subscribe", true)));
	}

	@Test
	void mergeKeepsRightOperandOnConflict() {
		CapabilitySet left = CapabilitySet.fromMap(Map.of("tools", Map.of("listChanged", true)));
		CapabilitySet right = CapabilitySet.fromMap(Map.of("tools", Map.of("listChanged", false)));

		assertThat(left.merge(right).get("tools")).isEqualTo(Map.of("listChanged", false));
		assertThat(right.merge(left).get("tools")).isEqualTo(Map.of("listChanged", true));
	}

	@Test
	void mergeTakesSlotVerbatimWhenReceiverLacksIt() {
		CapabilitySet left = CapabilitySet.builder().tools(true).build();
		CapabilitySet right = CapabilitySet.builder().resources(true, false).build();

		CapabilitySet merged = left.merge(right);
		assertThat(merged.get("tools")).isEqualTo(Map.of("listChanged", true));
		assertThat(merged.get("resources")).isEqualTo(Map.of("subscribe", true, "listChanged", false));
	}

	@Test
	void mergeVendorCapabilities() {
		CapabilitySet left = new CapabilitySet();
		left.set("acme", Map.of("a", 1, "b", 1));
		left.set("flag", "old");
		left.set("mixed", Map.of("x", 1));
		CapabilitySet right = new CapabilitySet();
		right.set("acme", Map.of("b", 2));
		right.set("flag", "new");
		right.set("mixed", "scalar");

		CapabilitySet merged = left.merge(right);
		assertThat(merged.get("acme")).isEqualTo(Map.of("a", 1, "b", 2));
		assertThat(merged.get("flag")).isEqualTo("new");
		assertThat(merged.get("mixed")).isEqualTo("scalar");
	}

	@Test
	void mergeDoesNotAliasOperands() {
		Map<String, Object> nested = new LinkedHashMap<>();
		nested.put("listChanged", true);
		CapabilitySet left = CapabilitySet.fromMap(Map.of("tools", nested));
		CapabilitySet right = CapabilitySet.fromMap(Map.of("prompts", Map.of("listChanged", true)));

		CapabilitySet merged = left.merge(right);
		merged.set("tools", Map.of("listChanged", false));
		nested.put("listChanged", false);

		assertThat(left.get("tools")).isEqualTo(Map.of("listChanged", true));
		assertThat(left.has("prompts")).isFalse();
		assertThat(right.has("tools")).isFalse();
	}

	@Test
	@SuppressWarnings("unchecked")
	void valuesReturnedByGetAreCopies() {
		CapabilitySet capabilities = CapabilitySet.builder().tools(true).build();
		((Map<String, Object>) capabilities.get("tools")).put("listChanged", false);
		assertThat(capabilities.get("tools")).isEqualTo(Map.of("listChanged", true));
	}

	@Test
	void foldingMergesInOrderMatchesSequentialApplication() {
		List<CapabilitySet> sets = List.of(CapabilitySet.fromMap(Map.of("tools", Map.of("a", 1))),
				CapabilitySet.fromMap(Map.of("tools", Map.of("a", 2, "b", 2))),
				CapabilitySet.fromMap(Map.of("tools", Map.of("b", 3), "logging", Map.of())));

		CapabilitySet folded = CapabilitySet.empty();
		for (CapabilitySet set : sets) {
			folded = folded.merge(set);
		}
		CapabilitySet nested = sets.get(0).merge(sets.get(1)).merge(sets.get(2));

		assertThat(folded).isEqualTo(nested);
		assertThat(folded.get("tools")).isEqualTo(Map.of("a", 2, "b", 3));
	}

	@Test
	void fromMapAndCopyAreEqual() {
		CapabilitySet capabilities = CapabilitySet.fromMap(Map.of("logging", Map.of(), "acme", Map.of("x", 1)));
		assertThat(capabilities.copy()).isEqualTo(capabilities).hasSameHashCodeAs(capabilities);
		assertThat(capabilities.has("acme")).isTrue();
	}

	@Test
	void builderRejectsWellKnownNameAsVendorCapability() {
		assertThatThrownBy(() -> CapabilitySet.builder().capability("tools", Map.of()))
			.isInstanceOf(IllegalArgumentException.class);
	}

}
