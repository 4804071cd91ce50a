package io.evitadb.lingua.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UsageInfo should derive remaining characters and percentage")
public class UsageInfoTest {

	@Test
	@DisplayName("shouldRoundPercentageToTwoDecimals")
	void shouldRoundPercentageToTwoDecimals() {
		final UsageInfo usage = new UsageInfo(1, 3, null, null, null, null);

		assertEquals(33.33, usage.percentageUsed());
		assertEquals(2, usage.remaining());
	}

	@Test
	@DisplayName("shouldReportZeroPercentForZeroLimit")
	void shouldReportZeroPercentForZeroLimit() {
		final UsageInfo usage = new UsageInfo(10, 0, null, null, null, null);

		assertEquals(0.0, usage.percentageUsed());
		assertEquals(-10, usage.remaining());
	}

	@Test
	@DisplayName("shouldRenderReadableSummary")
	void shouldRenderReadableSummary() {
		assertEquals(
			"UsageInfo[characters=500/1000 (50.00%), remaining=500]",
			new UsageInfo(500, 1000, 400L, 1000L, "2024-01-01", "2024-02-01").toString()
		);
	}
}
